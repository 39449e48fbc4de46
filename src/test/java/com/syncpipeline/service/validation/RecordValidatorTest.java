package com.syncpipeline.service.validation;

import com.syncpipeline.TestRecords;
import com.syncpipeline.model.LooseValue;
import com.syncpipeline.model.ValidationResult;
import com.syncpipeline.model.error.ValidationError;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;

import static com.syncpipeline.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for RecordValidator.
 *
 * Tests verify:
 * - Each structural rule produces its error variant with the record index
 * - Errors are ordered by record, then by check
 * - Optional fields are only checked when present in the expected shape
 */
class RecordValidatorTest {

    private final RecordValidator validator = new RecordValidator();

    @Test
    @DisplayName("Empty batch is valid")
    void emptyBatchIsValid() {
        ValidationResult result = validator.validate(List.of());

        assertThat(result.isValid()).isTrue();
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("Well-formed records produce no errors")
    void wellFormedRecordsAreValid() {
        ValidationResult result = validator.validate(TestRecords.validBatch(5));

        assertThat(result.isValid()).isTrue();
    }

    @Test
    @DisplayName("Non-mapping elements are reported as InvalidFormat")
    void nonMappingIsInvalidFormat() {
        List<LooseValue> batch = List.of(
                TestRecords.validRecord(0),
                new LooseValue.Text("not a record"),
                new LooseValue.Unsupported("array", "[]"),
                LooseValue.absent());

        ValidationResult result = validator.validate(batch);

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly(
                new ValidationError.InvalidFormat(1),
                new ValidationError.InvalidFormat(2),
                new ValidationError.InvalidFormat(3));
    }

    @Test
    @DisplayName("Missing id is reported for the right index only")
    void missingIdIsReported() {
        List<LooseValue> batch = List.of(
                record("from", "x@y.com"),
                record("id", "2", "from", "a@b.com"));

        ValidationResult result = validator.validate(batch);

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).containsExactly(new ValidationError.MissingField("id", 0));
    }

    @Test
    @DisplayName("An id explicitly set to null counts as missing")
    void absentIdCountsAsMissing() {
        ValidationResult result = validator.validate(List.of(record("id", null, "from", "a@b.com")));

        assertThat(result.errors()).containsExactly(new ValidationError.MissingField("id", 0));
    }

    @Test
    @DisplayName("Numeric ids are accepted")
    void numericIdIsAccepted() {
        ValidationResult result = validator.validate(List.of(record("id", 42, "from", "a@b.com")));

        assertThat(result.isValid()).isTrue();
    }

    @Test
    @DisplayName("Either from_address or from satisfies the origin requirement")
    void eitherOriginKeyIsAccepted() {
        List<LooseValue> batch = List.of(
                record("id", "1", "from", "plain@example.com"),
                record("id", "2", "from_address", record("email", "nested@example.com")),
                record("id", "3", "from_address", "raw string address"));

        assertThat(validator.validate(batch).isValid()).isTrue();
    }

    @Test
    @DisplayName("Missing origin address reports the combined field label")
    void missingOriginIsReported() {
        ValidationResult result = validator.validate(List.of(record("id", "1")));

        assertThat(result.errors()).containsExactly(new ValidationError.MissingField("from_address/from", 0));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "2024-03-15",
            "2024-03-15T10:30:00Z",
            "2024-03-15T10:30:00.123Z",
            "2024-02-30T10:30:00.123456Z",
            "15/03/2024 10:30",
            ""
    })
    @DisplayName("Dates outside the sync timestamp format are reported")
    void badDatesAreReported(String date) {
        ValidationResult result = validator.validate(List.of(record("id", "1", "from", "a@b.com", "date", date)));

        assertThat(result.errors()).containsExactly(new ValidationError.InvalidDate(date, 0));
    }

    @Test
    @DisplayName("Non-text dates are not checked")
    void nonTextDateIsIgnored() {
        ValidationResult result = validator.validate(List.of(
                record("id", "1", "from", "a@b.com", "date", new LooseValue.Numeric(BigDecimal.valueOf(1710498600)))));

        assertThat(result.isValid()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"no-at-sign", "a@b", "a@b.c", "@example.com", "a b@example.com"})
    @DisplayName("Malformed emails in from_address are reported")
    void badEmailsAreReported(String email) {
        ValidationResult result = validator.validate(List.of(
                record("id", "1", "from_address", record("email", email))));

        assertThat(result.errors()).containsExactly(new ValidationError.InvalidEmail(email, 0));
    }

    @Test
    @DisplayName("Email under the plain 'from' key is not pattern-checked")
    void plainFromIsNotEmailChecked() {
        ValidationResult result = validator.validate(List.of(record("id", "1", "from", "Jane <not an address>")));

        assertThat(result.isValid()).isTrue();
    }

    @Test
    @DisplayName("Errors are ordered by record then by check")
    void errorsFollowCheckOrder() {
        List<LooseValue> batch = List.of(
                record("date", "yesterday", "from_address", record("email", "broken")),
                new LooseValue.Text("junk"),
                record("subject", "nothing else"));

        ValidationResult result = validator.validate(batch);

        assertThat(result.errors()).containsExactly(
                new ValidationError.MissingField("id", 0),
                new ValidationError.InvalidDate("yesterday", 0),
                new ValidationError.InvalidEmail("broken", 0),
                new ValidationError.InvalidFormat(1),
                new ValidationError.MissingField("id", 2),
                new ValidationError.MissingField("from_address/from", 2));
    }

    @Test
    @DisplayName("Validating the same input twice yields the same result")
    void validationIsDeterministic() {
        List<LooseValue> batch = List.of(
                record("date", "bad"),
                TestRecords.validRecord(1),
                new LooseValue.Text("junk"));

        assertThat(validator.validate(batch)).isEqualTo(validator.validate(batch));
    }

    @Test
    @DisplayName("Error descriptions name the field and index")
    void descriptionsAreReadable() {
        ValidationResult result = validator.validate(List.of(record("from", "a@b.com")));

        assertThat(result.errors().get(0).description()).isEqualTo("Missing required field 'id' at index 0");
    }
}
