package com.example.reconciliation.config;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.reconciliation.domain.CounterpartyType;

/** Turns bound properties into the immutable policy objects the components are built with. */
@Configuration
@EnableConfigurationProperties(ReconciliationProperties.class)
public class ReconciliationConfig {

  private static final Logger log = LoggerFactory.getLogger(ReconciliationConfig.class);

  @Bean
  public MatchingPolicy matchingPolicy(ReconciliationProperties properties) {
    MatchingPolicy defaults = MatchingPolicy.defaults();

    Map<CounterpartyType, MatchingPolicy.Tolerance> tolerances =
        new EnumMap<>(CounterpartyType.class);
    tolerances.putAll(defaults.tolerances());
    properties
        .getTolerances()
        .forEach(
            (type, tolerance) ->
                tolerances.put(
                    type,
                    new MatchingPolicy.Tolerance(
                        tolerance.getDateWindowDays(), tolerance.getAmountTolerance())));

    ReconciliationProperties.Scoring scoring = properties.getScoring();
    MatchingPolicy policy =
        new MatchingPolicy(
            tolerances,
            scoring.getExactAmountWeight(),
            scoring.getExactDateWeight(),
            scoring.getDescriptionWeight(),
            scoring.getReferenceWeight(),
            scoring.getAcceptanceThreshold(),
            scoring.getMinimumMargin(),
            properties.getReversal().getWindowDays(),
            properties.getReversal().getKeywords());

    tolerances.forEach(
        (type, tolerance) ->
            log.info(
                "Matching tolerance {}: +/-{} days, +/-{}",
                type,
                tolerance.dateWindowDays(),
                tolerance.amountTolerance()));
    return policy;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
