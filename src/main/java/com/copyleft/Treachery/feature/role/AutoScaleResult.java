package com.copyleft.Treachery.feature.role;

public record AutoScaleResult(boolean canScale, String details) {

    public static AutoScaleResult scalable(String details) {
        return new AutoScaleResult(true, details);
    }

    public static AutoScaleResult notScalable(String details) {
        return new AutoScaleResult(false, details);
    }
}
