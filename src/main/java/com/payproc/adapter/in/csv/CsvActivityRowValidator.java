package com.payproc.adapter.in.csv;

import com.payproc.domain.model.ActivityType;
import com.payproc.domain.model.Amounts;
import com.payproc.domain.model.ClientId;
import com.payproc.domain.model.TransactionId;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates raw CSV activity records before conversion.
 * Amount sign rules are left to the account, except textual negative zero which
 * an exact decimal cannot carry. Amounts outside the ledger's decimal domain
 * ({@link Amounts#isRepresentable}) fail here so that they never reach an account.
 */
public class CsvActivityRowValidator {

    public ValidationResult validate(CsvActivityRow row) {
        List<String> errors = new ArrayList<>();

        validateRequiredFields(row, errors);
        validateDataTypes(row, errors);
        validateEnumValues(row, errors);

        if (errors.isEmpty()) {
            return ValidationResult.valid();
        } else {
            return ValidationResult.invalid(errors);
        }
    }

    private void validateRequiredFields(CsvActivityRow row, List<String> errors) {
        if (isBlank(row.getType())) {
            errors.add("type is required");
        }
        if (isBlank(row.getClient())) {
            errors.add("client is required");
        }
        if (isBlank(row.getTx())) {
            errors.add("tx is required");
        }
        if (carriesAmount(row) && isBlank(row.getAmount())) {
            errors.add("amount is required for " + row.getType().trim());
        }
    }

    private void validateDataTypes(CsvActivityRow row, List<String> errors) {
        if (!isBlank(row.getClient()) && parseUnsigned(row.getClient(), ClientId.MAX_VALUE) < 0) {
            errors.add("client must be an integer between 0 and " + ClientId.MAX_VALUE);
        }

        if (!isBlank(row.getTx()) && parseUnsigned(row.getTx(), TransactionId.MAX_VALUE) < 0) {
            errors.add("tx must be an integer between 0 and " + TransactionId.MAX_VALUE);
        }

        if (carriesAmount(row) && !isBlank(row.getAmount())) {
            String amount = row.getAmount().trim();
            try {
                BigDecimal value = new BigDecimal(amount);
                if (value.signum() == 0 && amount.startsWith("-")) {
                    errors.add("amount must not be negative zero");
                } else if (value.scale() > Amounts.MAX_SCALE) {
                    errors.add("amount must have at most " + Amounts.MAX_SCALE + " decimal places");
                } else if (!Amounts.isRepresentable(value)) {
                    errors.add("amount must have at most " + Amounts.MAX_INTEGER_DIGITS + " integer digits");
                }
            } catch (NumberFormatException e) {
                errors.add("amount must be a decimal number");
            }
        }
    }

    private void validateEnumValues(CsvActivityRow row, List<String> errors) {
        if (!isBlank(row.getType()) && !ActivityType.isValid(row.getType().trim())) {
            errors.add("type must be one of: deposit, withdrawal, dispute, resolve, chargeback");
        }
    }

    private boolean carriesAmount(CsvActivityRow row) {
        return !isBlank(row.getType())
                && ActivityType.isValid(row.getType().trim())
                && ActivityType.fromValue(row.getType().trim()).carriesAmount();
    }

    /**
     * @return the parsed value, or -1 if the text is not an integer in {@code [0, max]}
     */
    static long parseUnsigned(String text, long max) {
        try {
            long value = Long.parseLong(text.trim());
            return value >= 0 && value <= max ? value : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
