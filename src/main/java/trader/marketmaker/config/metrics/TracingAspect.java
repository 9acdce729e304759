package trader.marketmaker.config.metrics;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

/**
 * Wraps every public chain client call (eth_call, transaction submission, receipt wait) in an observation.
 */
@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
public class TracingAspect {

    private final ObservationRegistry observationRegistry;

    @Pointcut("execution(public * trader.marketmaker.client.chain.*ChainClient.*(..))")
    public void chainClientMethods() {}

    @Around("chainClientMethods()")
    public Object traceChainCalls(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        String methodName = method.getName();
        String className = method.getDeclaringClass().getSimpleName();

        Observation observation = Observation.createNotStarted("chain.client." + methodName, observationRegistry)
                .lowCardinalityKeyValue("className", className)
                .lowCardinalityKeyValue("methodName", methodName)
                .start();
        // checked ChainClientException must reach the caller unchanged, so no observe(Supplier) here
        try (Observation.Scope scope = observation.openScope()) {
            return joinPoint.proceed();
        } catch (Throwable t) {
            observation.error(t);
            log.debug("Chain call {}.{} failed: {}", className, methodName, t.getMessage());
            throw t;
        } finally {
            observation.stop();
        }
    }
}
