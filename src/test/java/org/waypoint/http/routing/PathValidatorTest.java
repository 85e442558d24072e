package org.waypoint.http.routing;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class PathValidatorTest {

    @ParameterizedTest
    @ValueSource(strings = {"users", "users/", "users/profile", "users/profile/", "a/b/c/d", "v2", "snake_case/x1"})
    void accepts_word_segments_separated_by_slashes(String path) {
        assertThat(PathValidator.isValid(path)).isTrue();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"/", "/users", "users//profile", "user-profile", "users profile", "users/*",
            "users?id=1", "users//", ".."})
    void rejects_anything_else(String path) {
        assertThat(PathValidator.isValid(path)).isFalse();
    }

}
