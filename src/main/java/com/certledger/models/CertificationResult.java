package com.certledger.models;

/**
 * What the submission layer gets back from one certification run.
 * {@code certificate} is null when the contribution was not certified.
 */
public class CertificationResult {

    private String contributionId;
    private CertificationStatus status;
    private Tier tier;
    private double score;
    private long amount;
    private Integer epochIndex;
    private String justification;
    private Certificate certificate;

    public static CertificationResult notCertified(Evaluation evaluation) {
        CertificationResult result = new CertificationResult();
        result.setContributionId(evaluation.getContributionId());
        result.setStatus(CertificationStatus.NOT_CERTIFIED);
        result.setTier(evaluation.getTier());
        result.setScore(evaluation.getScore());
        result.setAmount(0);
        result.setJustification(evaluation.getJustification());
        return result;
    }

    public static CertificationResult certified(CertificationStatus status, Certificate certificate, String justification) {
        CertificationResult result = new CertificationResult();
        result.setContributionId(certificate.getContributionId());
        result.setStatus(status);
        result.setTier(certificate.getTier());
        result.setScore(certificate.getScore());
        result.setAmount(certificate.getAmount());
        result.setEpochIndex(certificate.getEpochIndex());
        result.setJustification(justification);
        result.setCertificate(certificate);
        return result;
    }

    public String getContributionId() {
        return contributionId;
    }

    public void setContributionId(String contributionId) {
        this.contributionId = contributionId;
    }

    public CertificationStatus getStatus() {
        return status;
    }

    public void setStatus(CertificationStatus status) {
        this.status = status;
    }

    public Tier getTier() {
        return tier;
    }

    public void setTier(Tier tier) {
        this.tier = tier;
    }

    public double getScore() {
        return score;
    }

    public void setScore(double score) {
        this.score = score;
    }

    public long getAmount() {
        return amount;
    }

    public void setAmount(long amount) {
        this.amount = amount;
    }

    public Integer getEpochIndex() {
        return epochIndex;
    }

    public void setEpochIndex(Integer epochIndex) {
        this.epochIndex = epochIndex;
    }

    public String getJustification() {
        return justification;
    }

    public void setJustification(String justification) {
        this.justification = justification;
    }

    public Certificate getCertificate() {
        return certificate;
    }

    public void setCertificate(Certificate certificate) {
        this.certificate = certificate;
    }
}
