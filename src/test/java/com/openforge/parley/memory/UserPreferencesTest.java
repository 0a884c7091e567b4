package com.openforge.parley.memory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class UserPreferencesTest {

    private final UserPreferences preferences = new UserPreferences(3);

    @Test
    @DisplayName("confidence rises monotonically and the value activates at the threshold")
    void promotion() {
        Preference first  = preferences.learn("explanation_style", "use_examples", "true");
        Preference second = preferences.learn("explanation_style", "use_examples", "true");
        Preference third  = preferences.learn("explanation_style", "use_examples", "true");

        assertThat(first.confidence()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(second.confidence()).isGreaterThan(first.confidence());
        assertThat(second.active()).isFalse();
        assertThat(third.active()).isTrue();
        assertThat(third.confidence()).isEqualTo(1.0);
        assertThat(preferences.activePreferences()).extracting(Preference::path)
                .containsExactly("explanation_style.use_examples");
    }

    @Test
    @DisplayName("confidence is capped at 1 after further observations")
    void capped() {
        for (int i = 0; i < 5; i++) preferences.learn("difficulty_level", "level", "hard");

        assertThat(preferences.get("difficulty_level", "level", "hard")).get()
                .satisfies(p -> {
                    assertThat(p.confidence()).isEqualTo(1.0);
                    assertThat(p.observationCount()).isEqualTo(5);
                });
    }

    @Test
    @DisplayName("the most observed value of a key wins when several are active")
    void mostObservedWins() {
        for (int i = 0; i < 3; i++) preferences.learn("difficulty_level", "level", "easy");
        for (int i = 0; i < 4; i++) preferences.learn("difficulty_level", "level", "hard");

        assertThat(preferences.activePreferences()).singleElement()
                .extracting(Preference::value).isEqualTo("hard");
        assertThat(preferences.isActive("difficulty_level", "level")).isTrue();
    }

    @Test
    @DisplayName("restore never lowers a count already in memory")
    void restoreTakesMax() {
        for (int i = 0; i < 3; i++) preferences.learn("explanation_style", "concise", "true");

        preferences.restore(List.of(
                new Preference("explanation_style", "concise", "true", 0.33, 1, false),
                new Preference("explanation_style", "detailed", "true", 1.0, 4, true)));

        assertThat(preferences.get("explanation_style", "concise", "true")).get()
                .extracting(Preference::observationCount).isEqualTo(3);
        assertThat(preferences.isActive("explanation_style", "detailed")).isTrue();
    }

    @Test
    @DisplayName("snapshot lists every observed value, most observed first")
    void snapshot() {
        preferences.learn("a", "k", "1");
        preferences.learn("b", "k", "1");
        preferences.learn("b", "k", "1");

        assertThat(preferences.snapshot()).extracting(Preference::category).containsExactly("b", "a");
    }

    @Test
    @DisplayName("learned observations exclude restored counts")
    void learnedObservations() {
        preferences.restore(List.of(
                new Preference("explanation_style", "use_examples", "true", 0.66, 2, false)));
        preferences.learn("explanation_style", "use_examples", "true");
        preferences.learn("difficulty_level", "level", "hard");

        assertThat(preferences.learnedObservations())
                .extracting(Preference::category, Preference::observationCount)
                .containsExactlyInAnyOrder(
                        tuple("explanation_style", 1),
                        tuple("difficulty_level", 1));
        assertThat(preferences.get("explanation_style", "use_examples", "true")).get()
                .extracting(Preference::observationCount).isEqualTo(3);
    }
}
