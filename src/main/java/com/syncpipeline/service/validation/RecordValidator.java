package com.syncpipeline.service.validation;

import com.syncpipeline.model.LooseValue;
import com.syncpipeline.model.RawRecord;
import com.syncpipeline.model.ValidationResult;
import com.syncpipeline.model.error.ValidationError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural checks on a decoded batch, run before anything touches storage.
 *
 * VALIDATION RULES (checked in this order per record):
 * 1. element must be a mapping                  → InvalidFormat
 * 2. "id" must be present                       → MissingField("id")
 * 3. "from_address" or "from" must be present   → MissingField("from_address/from")
 * 4. a text "date" must parse as the sync timestamp format → InvalidDate
 * 5. a text "email" inside a "from_address" mapping must look like an address → InvalidEmail
 *
 * Malformed input never throws; every defect is reported as data.
 */
@Component
@Slf4j
public class RecordValidator {

    public static final String FROM_ADDRESS = "from_address";
    public static final String FROM = "from";
    public static final String DATE = "date";
    public static final String EMAIL = "email";

    static final String ORIGIN_FIELD_LABEL = FROM_ADDRESS + "/" + FROM;

    private static final DateTimeFormatter SYNC_TIMESTAMP = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'")
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("[A-Z0-9a-z._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,64}");

    /**
     * Validate every element of the batch. Errors are ordered by record, then by check.
     */
    public ValidationResult validate(List<? extends LooseValue> batch) {
        List<ValidationError> errors = new ArrayList<>();
        for (int index = 0; index < batch.size(); index++) {
            LooseValue element = batch.get(index);
            if (element instanceof LooseValue.Mapping record) {
                validateRecord(record, index, errors);
            } else {
                errors.add(new ValidationError.InvalidFormat(index));
            }
        }

        if (!errors.isEmpty()) {
            log.debug("Validation found {} errors in {} records", errors.size(), batch.size());
        }
        return new ValidationResult(errors);
    }

    private void validateRecord(LooseValue.Mapping record, int index, List<ValidationError> errors) {
        if (!record.has(RawRecord.ID)) {
            errors.add(new ValidationError.MissingField(RawRecord.ID, index));
        }

        if (!record.has(FROM_ADDRESS) && !record.has(FROM)) {
            errors.add(new ValidationError.MissingField(ORIGIN_FIELD_LABEL, index));
        }

        record.get(DATE).asText()
                .filter(date -> !isValidDate(date))
                .ifPresent(date -> errors.add(new ValidationError.InvalidDate(date, index)));

        record.get(FROM_ADDRESS).asMapping()
                .flatMap(address -> address.get(EMAIL).asText())
                .filter(email -> !isValidEmail(email))
                .ifPresent(email -> errors.add(new ValidationError.InvalidEmail(email, index)));
    }

    static boolean isValidDate(String value) {
        try {
            LocalDateTime.parse(value, SYNC_TIMESTAMP);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    static boolean isValidEmail(String value) {
        return EMAIL_PATTERN.matcher(value).matches();
    }
}
