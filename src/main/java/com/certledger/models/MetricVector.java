package com.certledger.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Document-level metrics produced by the external scorer, each expected in [0,1].
 * Components are boxed so a field absent from the payload stays null instead of reading as 0.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricVector {

    private Double coherence;
    private Double density;
    private Double novelty;
    private Double redundancy;

    public MetricVector() {
    }

    public MetricVector(double coherence, double density, double novelty, double redundancy) {
        this.coherence = coherence;
        this.density = density;
        this.novelty = novelty;
        this.redundancy = redundancy;
    }

    public Double getCoherence() {
        return coherence;
    }

    public void setCoherence(Double coherence) {
        this.coherence = coherence;
    }

    public Double getDensity() {
        return density;
    }

    public void setDensity(Double density) {
        this.density = density;
    }

    public Double getNovelty() {
        return novelty;
    }

    public void setNovelty(Double novelty) {
        this.novelty = novelty;
    }

    public Double getRedundancy() {
        return redundancy;
    }

    public void setRedundancy(Double redundancy) {
        this.redundancy = redundancy;
    }

    public MetricVector copy() {
        MetricVector copy = new MetricVector();
        copy.setCoherence(coherence);
        copy.setDensity(density);
        copy.setNovelty(novelty);
        copy.setRedundancy(redundancy);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MetricVector)) {
            return false;
        }
        MetricVector that = (MetricVector) o;
        return Objects.equals(coherence, that.coherence)
            && Objects.equals(density, that.density)
            && Objects.equals(novelty, that.novelty)
            && Objects.equals(redundancy, that.redundancy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coherence, density, novelty, redundancy);
    }

    @Override
    public String toString() {
        return "MetricVector{coherence=" + coherence + ", density=" + density
            + ", novelty=" + novelty + ", redundancy=" + redundancy + "}";
    }
}
