package org.javai.backoff.classify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class HttpStatusClassifierTest {

    @ParameterizedTest
    @ValueSource(ints = {408, 429, 500, 502, 503, 504})
    void transientStatuses_areRetryable(int status) {
        assertThat(HttpStatusClassifier.isRetryableStatus(status)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {200, 201, 204, 301, 304, 400, 401, 403, 404, 409, 422, 501, 505, 511})
    void otherStatuses_areNotRetryable(int status) {
        assertThat(HttpStatusClassifier.isRetryableStatus(status)).isFalse();
    }

    @Test
    void outOfRangeCodes_areNotRetryable() {
        assertThat(HttpStatusClassifier.isRetryableStatus(-1)).isFalse();
        assertThat(HttpStatusClassifier.isRetryableStatus(0)).isFalse();
        assertThat(HttpStatusClassifier.isRetryableStatus(1503)).isFalse();
    }

    @Test
    void constants_matchStatusCodes() {
        assertThat(HttpStatusClassifier.SERVICE_UNAVAILABLE).isEqualTo(503);
        assertThat(HttpStatusClassifier.TOO_MANY_REQUESTS).isEqualTo(429);
    }
}
