package com.certledger.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SubmissionRequest {

    private String contributionId;
    private String contributorId;
    private MetricVector metrics;

    public String getContributionId() {
        return contributionId;
    }

    public void setContributionId(String contributionId) {
        this.contributionId = contributionId;
    }

    public String getContributorId() {
        return contributorId;
    }

    public void setContributorId(String contributorId) {
        this.contributorId = contributorId;
    }

    public MetricVector getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricVector metrics) {
        this.metrics = metrics;
    }
}
