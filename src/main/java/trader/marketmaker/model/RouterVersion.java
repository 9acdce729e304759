package trader.marketmaker.model;

public enum RouterVersion {
    V2,
    V3
}
