package com.example.reconciliation.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.example.reconciliation.domain.CounterpartyType;

/**
 * Tunables bound from {@code reconciliation.*}. The shipped values are placeholders; date windows
 * and amount tolerances per counterparty type have to be confirmed by the business owner.
 */
@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

  private Map<CounterpartyType, Tolerance> tolerances = new EnumMap<>(CounterpartyType.class);
  private Scoring scoring = new Scoring();
  private Reversal reversal = new Reversal();
  private int previewSampleSize = 20;
  private Duration previewTtl = Duration.ofMinutes(30);
  private String processTag = "auto-reconcile";

  public Map<CounterpartyType, Tolerance> getTolerances() {
    return tolerances;
  }

  public void setTolerances(Map<CounterpartyType, Tolerance> tolerances) {
    this.tolerances = tolerances;
  }

  public Scoring getScoring() {
    return scoring;
  }

  public void setScoring(Scoring scoring) {
    this.scoring = scoring;
  }

  public Reversal getReversal() {
    return reversal;
  }

  public void setReversal(Reversal reversal) {
    this.reversal = reversal;
  }

  public int getPreviewSampleSize() {
    return previewSampleSize;
  }

  public void setPreviewSampleSize(int previewSampleSize) {
    this.previewSampleSize = previewSampleSize;
  }

  /** How long an issued preview may wait for apply before it is dropped. */
  public Duration getPreviewTtl() {
    return previewTtl;
  }

  public void setPreviewTtl(Duration previewTtl) {
    this.previewTtl = previewTtl;
  }

  public String getProcessTag() {
    return processTag;
  }

  public void setProcessTag(String processTag) {
    this.processTag = processTag;
  }

  /** Date window (days either side) and amount tolerance for one counterparty type. */
  public static class Tolerance {
    private int dateWindowDays;
    private BigDecimal amountTolerance = BigDecimal.ZERO;

    public int getDateWindowDays() {
      return dateWindowDays;
    }

    public void setDateWindowDays(int dateWindowDays) {
      this.dateWindowDays = dateWindowDays;
    }

    public BigDecimal getAmountTolerance() {
      return amountTolerance;
    }

    public void setAmountTolerance(BigDecimal amountTolerance) {
      this.amountTolerance = amountTolerance;
    }
  }

  public static class Scoring {
    private BigDecimal exactAmountWeight = new BigDecimal("0.50");
    private BigDecimal exactDateWeight = new BigDecimal("0.30");
    private BigDecimal descriptionWeight = new BigDecimal("0.20");
    private BigDecimal referenceWeight = new BigDecimal("0.20");
    private BigDecimal acceptanceThreshold = new BigDecimal("0.75");
    private BigDecimal minimumMargin = new BigDecimal("0.10");

    public BigDecimal getExactAmountWeight() {
      return exactAmountWeight;
    }

    public void setExactAmountWeight(BigDecimal exactAmountWeight) {
      this.exactAmountWeight = exactAmountWeight;
    }

    public BigDecimal getExactDateWeight() {
      return exactDateWeight;
    }

    public void setExactDateWeight(BigDecimal exactDateWeight) {
      this.exactDateWeight = exactDateWeight;
    }

    public BigDecimal getDescriptionWeight() {
      return descriptionWeight;
    }

    public void setDescriptionWeight(BigDecimal descriptionWeight) {
      this.descriptionWeight = descriptionWeight;
    }

    public BigDecimal getReferenceWeight() {
      return referenceWeight;
    }

    public void setReferenceWeight(BigDecimal referenceWeight) {
      this.referenceWeight = referenceWeight;
    }

    public BigDecimal getAcceptanceThreshold() {
      return acceptanceThreshold;
    }

    public void setAcceptanceThreshold(BigDecimal acceptanceThreshold) {
      this.acceptanceThreshold = acceptanceThreshold;
    }

    public BigDecimal getMinimumMargin() {
      return minimumMargin;
    }

    public void setMinimumMargin(BigDecimal minimumMargin) {
      this.minimumMargin = minimumMargin;
    }
  }

  public static class Reversal {
    private int windowDays = 5;
    private List<String> keywords =
        new ArrayList<>(List.of("REVERSAL", "REVERSE", "NSF", "RETURN", "CHARGEBACK", "CORRECTION"));

    public int getWindowDays() {
      return windowDays;
    }

    public void setWindowDays(int windowDays) {
      this.windowDays = windowDays;
    }

    public List<String> getKeywords() {
      return keywords;
    }

    public void setKeywords(List<String> keywords) {
      this.keywords = keywords;
    }
  }
}
