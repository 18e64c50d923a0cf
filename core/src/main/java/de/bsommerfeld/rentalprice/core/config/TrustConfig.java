package de.bsommerfeld.rentalprice.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Weights and thresholds for the review trust and host quality scores.
 * Both weight groups must each sum to 1.
 */
public class TrustConfig {

    @JsonProperty("rating-scale")
    private double ratingScale = 5.0;

    @JsonProperty("min-reviews")
    private int minReviews = 5;

    @JsonProperty("review-saturation")
    private int reviewSaturation = 100;

    @JsonProperty("rating-weight")
    private double ratingWeight = 0.4;

    @JsonProperty("review-count-weight")
    private double reviewCountWeight = 0.3;

    @JsonProperty("sufficiency-weight")
    private double sufficiencyWeight = 0.3;

    @JsonProperty("superhost-weight")
    private double superhostWeight = 0.4;

    @JsonProperty("response-rate-weight")
    private double responseRateWeight = 0.25;

    @JsonProperty("verification-weight")
    private double verificationWeight = 0.2;

    @JsonProperty("tenure-weight")
    private double tenureWeight = 0.15;

    @JsonProperty("tenure-cap-years")
    private double tenureCapYears = 5.0;

    @JsonProperty("professional-host-listings")
    private int professionalHostListings = 3;

    public double getRatingScale() {
        return ratingScale;
    }

    public void setRatingScale(double ratingScale) {
        this.ratingScale = ratingScale;
    }

    public int getMinReviews() {
        return minReviews;
    }

    public void setMinReviews(int minReviews) {
        this.minReviews = minReviews;
    }

    public int getReviewSaturation() {
        return reviewSaturation;
    }

    public void setReviewSaturation(int reviewSaturation) {
        this.reviewSaturation = reviewSaturation;
    }

    public double getRatingWeight() {
        return ratingWeight;
    }

    public void setRatingWeight(double ratingWeight) {
        this.ratingWeight = ratingWeight;
    }

    public double getReviewCountWeight() {
        return reviewCountWeight;
    }

    public void setReviewCountWeight(double reviewCountWeight) {
        this.reviewCountWeight = reviewCountWeight;
    }

    public double getSufficiencyWeight() {
        return sufficiencyWeight;
    }

    public void setSufficiencyWeight(double sufficiencyWeight) {
        this.sufficiencyWeight = sufficiencyWeight;
    }

    public double getSuperhostWeight() {
        return superhostWeight;
    }

    public void setSuperhostWeight(double superhostWeight) {
        this.superhostWeight = superhostWeight;
    }

    public double getResponseRateWeight() {
        return responseRateWeight;
    }

    public void setResponseRateWeight(double responseRateWeight) {
        this.responseRateWeight = responseRateWeight;
    }

    public double getVerificationWeight() {
        return verificationWeight;
    }

    public void setVerificationWeight(double verificationWeight) {
        this.verificationWeight = verificationWeight;
    }

    public double getTenureWeight() {
        return tenureWeight;
    }

    public void setTenureWeight(double tenureWeight) {
        this.tenureWeight = tenureWeight;
    }

    public double getTenureCapYears() {
        return tenureCapYears;
    }

    public void setTenureCapYears(double tenureCapYears) {
        this.tenureCapYears = tenureCapYears;
    }

    public int getProfessionalHostListings() {
        return professionalHostListings;
    }

    public void setProfessionalHostListings(int professionalHostListings) {
        this.professionalHostListings = professionalHostListings;
    }
}
