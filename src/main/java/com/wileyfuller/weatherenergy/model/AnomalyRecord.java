package com.wileyfuller.weatherenergy.model;

public final class AnomalyRecord {

    private final MergedRecord record;
    private final double score;

    public AnomalyRecord(MergedRecord record, double score) {
        this.record = record;
        this.score = score;
    }

    public MergedRecord getRecord() {
        return record;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return String.format("AnomalyRecord{%s, score=%.4f}", record, score);
    }
}
