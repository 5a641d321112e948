package com.kotsin.challenge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A profit target expressed in R-multiples, closing a fraction of the original size.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TakeProfitLevel(double rMultiple, double closeFraction) {
}
