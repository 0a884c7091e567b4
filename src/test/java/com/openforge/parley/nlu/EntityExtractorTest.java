package com.openforge.parley.nlu;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class EntityExtractorTest {

    private final EntityExtractor extractor = new EntityExtractor();

    // =========================================================================
    //  Typed entities
    // =========================================================================

    @Nested
    @DisplayName("Typed entities")
    class TypedEntities {

        @Test
        @DisplayName("should extract URL and e-mail as separate entities")
        void urlAndEmail() {
            Extraction x = extractor.extract("open https://example.com/docs and mail bob@example.com");

            assertThat(x.entities().get("url").value()).isEqualTo("https://example.com/docs");
            assertThat(x.entities().get("email").value()).isEqualTo("bob@example.com");
        }

        @Test
        @DisplayName("should take the location from the capture group")
        void locationGroup() {
            Extraction x = extractor.extract("weather in New York tomorrow");

            assertThat(x.entities().get("location").value()).isEqualTo("New York");
            assertThat(x.entities().get("relative_date").value()).isEqualTo("tomorrow");
        }

        @Test
        @DisplayName("should recognise a CLI command")
        void cliCommand() {
            Extraction x = extractor.extract("please run npm install now");

            assertThat(x.has(EntityType.CLI_COMMAND)).isTrue();
            assertThat(x.entities().get("cli_command").value()).isEqualTo("npm install");
        }

        @Test
        @DisplayName("longest overlapping span wins: a time swallows its numbers")
        void longestSpanWins() {
            Extraction x = extractor.extract("call me at 10:30 pm");

            assertThat(x.entities().get("time").value()).isEqualTo("10:30 pm");
            assertThat(x.has(EntityType.NUMBER)).isFalse();
            assertThat(x.spans()).hasSize(1);
        }

        @Test
        @DisplayName("an IP address beats the shorter version and number matches inside it")
        void ipAddress() {
            Extraction x = extractor.extract("ping 192.168.1.10");

            assertThat(x.entities().get("ip_address").value()).isEqualTo("192.168.1.10");
            assertThat(x.has(EntityType.VERSION)).isFalse();
        }
    }

    // =========================================================================
    //  Numeric ambiguity
    // =========================================================================

    @Nested
    @DisplayName("Numeric ambiguity")
    class NumericAmbiguity {

        @Test
        @DisplayName("a number next to an identifier keyword becomes an IDENTIFIER")
        void identifier() {
            Extraction x = extractor.extract("check the status of pnr 1234567890");

            assertThat(x.entities().get("identifier").value()).isEqualTo("1234567890");
            assertThat(x.has(EntityType.NUMBER)).isFalse();
        }

        @Test
        @DisplayName("a number next to an amount keyword becomes an AMOUNT")
        void amount() {
            Extraction x = extractor.extract("pay 500 rupees");

            assertThat(x.entities().get("amount").value()).isEqualTo("500");
        }

        @Test
        @DisplayName("identifier keywords take precedence when both kinds are in range")
        void identifierWins() {
            Extraction x = extractor.extract("ticket 42 and pay 300");

            assertThat(x.entities().get("identifier").value()).isEqualTo("42");
            assertThat(x.entities().get("amount").value()).isEqualTo("300");
        }

        @Test
        @DisplayName("a number without keywords stays a NUMBER")
        void plainNumber() {
            Extraction x = extractor.extract("add 5 apples");

            assertThat(x.entities().get("number").value()).isEqualTo("5");
        }
    }

    // =========================================================================
    //  Slots
    // =========================================================================

    @Nested
    @DisplayName("Slot filling")
    class Slots {

        private final SlotSchema appSchema =
                SlotSchema.of(SlotSpec.required("target", EntityType.APPLICATION));

        @Test
        @DisplayName("should fill a slot from its own pattern first")
        void fromPattern() {
            SlotSchema schema = SlotSchema.of(SlotSpec.required("query", null, "search for (.+)"));

            Extraction x = extractor.extract("search for cheap flights", schema);

            assertThat(x.slots().get("query").value()).isEqualTo("cheap flights");
            assertThat(x.missingRequired()).isZero();
            assertThat(x.penalty(0.9)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should fall back to an entity of the expected type")
        void fromEntity() {
            Extraction x = extractor.extract("open spotify please", appSchema);

            assertThat(x.slots().get("target").value()).isEqualTo("spotify");
        }

        @Test
        @DisplayName("an unfilled required slot is penalised once")
        void missingRequired() {
            Extraction x = extractor.extract("open the pod bay doors", appSchema);

            assertThat(x.slots().get("target").isMissingRequired()).isTrue();
            assertThat(x.missingRequired()).isEqualTo(1);
            assertThat(x.penalty(0.9)).isEqualTo(0.9);
        }

        @Test
        @DisplayName("an unfilled optional slot carries no penalty")
        void missingOptional() {
            SlotSchema schema = SlotSchema.of(SlotSpec.optional("when", EntityType.RELATIVE_DATE));

            Extraction x = extractor.extract("remind me to call mum", schema);

            assertThat(x.slots().get("when").isFilled()).isFalse();
            assertThat(x.penalty(0.9)).isEqualTo(1.0);
        }
    }

    // =========================================================================
    //  Edge cases
    // =========================================================================

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("blank and null input yield empty results without throwing")
        void blankInput() {
            assertThatCode(() -> extractor.extract(null)).doesNotThrowAnyException();
            assertThat(extractor.extract(null).entities()).isEmpty();
            assertThat(extractor.extract("   ").spans()).isEmpty();
        }

        @Test
        @DisplayName("slots are reported unfilled on blank input")
        void blankInputWithSchema() {
            Extraction x = extractor.extract("", SlotSchema.of(SlotSpec.required("target", EntityType.APPLICATION)));

            assertThat(x.slots()).containsKey("target");
            assertThat(x.missingRequired()).isEqualTo(1);
        }

        @Test
        @DisplayName("text without entities yields an empty map")
        void noEntities() {
            assertThat(extractor.extract("tell me a joke").entities()).isEmpty();
        }
    }
}
