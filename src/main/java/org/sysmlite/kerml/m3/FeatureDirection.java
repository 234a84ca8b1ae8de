package org.sysmlite.kerml.m3;

public enum FeatureDirection {
    NONE,
    IN,
    OUT,
    INOUT;

    public static FeatureDirection fromKeyword(String keyword) {
        return switch (keyword) {
            case "in" -> IN;
            case "out" -> OUT;
            case "inout" -> INOUT;
            default -> NONE;
        };
    }
}
