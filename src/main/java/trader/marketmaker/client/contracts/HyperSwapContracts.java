package trader.marketmaker.client.contracts;

import lombok.experimental.UtilityClass;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.StaticStruct;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint160;
import org.web3j.abi.datatypes.generated.Uint24;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ABI definitions of the ERC-20, HyperSwap V2 router, V3 QuoterV2 and V3 SwapRouter calls we make.
 */
@UtilityClass
public class HyperSwapContracts {

    public static final BigInteger MAX_UINT256 = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    public static final String ALLOWANCE = "allowance";
    public static final String APPROVE = "approve";
    public static final String GET_AMOUNTS_OUT = "getAmountsOut";
    public static final String SWAP_EXACT_TOKENS_FOR_TOKENS = "swapExactTokensForTokens";
    public static final String QUOTE_EXACT_INPUT_SINGLE = "quoteExactInputSingle";
    public static final String EXACT_INPUT_SINGLE = "exactInputSingle";

    // ---- ERC-20 ----

    public Function allowance(String owner, String spender) {
        return new Function(
                ALLOWANCE,
                List.<Type>of(new Address(owner), new Address(spender)),
                List.<TypeReference<?>>of(new TypeReference<Uint256>() {}));
    }

    public Function approve(String spender, BigInteger amount) {
        return new Function(
                APPROVE,
                List.<Type>of(new Address(spender), new Uint256(amount)),
                List.<TypeReference<?>>of(new TypeReference<Bool>() {}));
    }

    // ---- V2 router ----

    public Function getAmountsOut(BigInteger amountIn, List<String> path) {
        return new Function(
                GET_AMOUNTS_OUT,
                List.<Type>of(new Uint256(amountIn), addressArray(path)),
                List.<TypeReference<?>>of(new TypeReference<DynamicArray<Uint256>>() {}));
    }

    public Function swapExactTokensForTokens(BigInteger amountIn, BigInteger amountOutMin, List<String> path,
                                             String recipient, BigInteger deadline) {
        return new Function(
                SWAP_EXACT_TOKENS_FOR_TOKENS,
                List.<Type>of(
                        new Uint256(amountIn),
                        new Uint256(amountOutMin),
                        addressArray(path),
                        new Address(recipient),
                        new Uint256(deadline)),
                List.<TypeReference<?>>of(new TypeReference<DynamicArray<Uint256>>() {}));
    }

    // ---- V3 QuoterV2 ----

    /**
     * quoteExactInputSingle((tokenIn, tokenOut, amountIn, fee, sqrtPriceLimitX96)) returns
     * (amountOut, sqrtPriceX96After, initializedTicksCrossed, gasEstimate).
     */
    public Function quoteExactInputSingle(String tokenIn, String tokenOut, BigInteger amountIn, int fee) {
        StaticStruct params = new StaticStruct(
                new Address(tokenIn),
                new Address(tokenOut),
                new Uint256(amountIn),
                new Uint24(BigInteger.valueOf(fee)),
                new Uint160(BigInteger.ZERO));
        return new Function(
                QUOTE_EXACT_INPUT_SINGLE,
                List.<Type>of(params),
                List.<TypeReference<?>>of(
                        new TypeReference<Uint256>() {},
                        new TypeReference<Uint160>() {},
                        new TypeReference<Uint32>() {},
                        new TypeReference<Uint256>() {}));
    }

    // ---- V3 SwapRouter ----

    /**
     * exactInputSingle((tokenIn, tokenOut, fee, recipient, deadline, amountIn, amountOutMinimum, sqrtPriceLimitX96)).
     */
    public Function exactInputSingle(String tokenIn, String tokenOut, int fee, String recipient,
                                     BigInteger deadline, BigInteger amountIn, BigInteger amountOutMinimum) {
        StaticStruct params = new StaticStruct(
                new Address(tokenIn),
                new Address(tokenOut),
                new Uint24(BigInteger.valueOf(fee)),
                new Address(recipient),
                new Uint256(deadline),
                new Uint256(amountIn),
                new Uint256(amountOutMinimum),
                new Uint160(BigInteger.ZERO));
        return new Function(
                EXACT_INPUT_SINGLE,
                List.<Type>of(params),
                List.<TypeReference<?>>of(new TypeReference<Uint256>() {}));
    }

    private DynamicArray<Address> addressArray(List<String> path) {
        List<Address> addresses = path.stream()
                .map(Address::new)
                .collect(Collectors.toList());
        return new DynamicArray<>(Address.class, addresses);
    }
}
