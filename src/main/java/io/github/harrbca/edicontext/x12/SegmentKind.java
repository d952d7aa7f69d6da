package io.github.harrbca.edicontext.x12;

public enum SegmentKind {
    ISA("/ISA_LOOP/ISA"),
    IEA("/ISA_LOOP/IEA"),
    GS("/ISA_LOOP/GS_LOOP/GS"),
    GE("/ISA_LOOP/GS_LOOP/GE"),
    ST("/ISA_LOOP/GS_LOOP/ST_LOOP/ST"),
    SE("/ISA_LOOP/GS_LOOP/ST_LOOP/SE"),
    BHT(null),
    OTHER(null);

    public static final String BHT_PATH = "/ISA_LOOP/GS_LOOP/ST_LOOP/HEADER/BHT";

    private final String envelopePath;

    SegmentKind(String envelopePath) {
        this.envelopePath = envelopePath;
    }

    public String getEnvelopePath() {
        return envelopePath;
    }

    public boolean isEnvelope() {
        return envelopePath != null;
    }

    public static SegmentKind of(String segmentId) {
        return switch (segmentId) {
            case "ISA" -> ISA;
            case "IEA" -> IEA;
            case "GS" -> GS;
            case "GE" -> GE;
            case "ST" -> ST;
            case "SE" -> SE;
            case "BHT" -> BHT;
            default -> OTHER;
        };
    }
}
