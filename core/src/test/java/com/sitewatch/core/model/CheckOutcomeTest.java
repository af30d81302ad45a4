package com.sitewatch.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CheckOutcomeTest {

    @Test
    void only_2xx_is_success() {
        assertThat(CheckOutcome.fromStatus(200)).isEqualTo(new CheckOutcome.Success(200));
        assertThat(CheckOutcome.fromStatus(299)).isEqualTo(new CheckOutcome.Success(299));
        assertThat(CheckOutcome.fromStatus(199)).isEqualTo(new CheckOutcome.HttpError(199));
        assertThat(CheckOutcome.fromStatus(301)).isEqualTo(new CheckOutcome.HttpError(301));
        assertThat(CheckOutcome.fromStatus(404).kind()).isEqualTo(CheckOutcome.Kind.HTTP_ERROR);
        assertThat(CheckOutcome.fromStatus(503).kind()).isEqualTo(CheckOutcome.Kind.HTTP_ERROR);
    }
}
