package com.example.logfilter.filter;

public class UnsupportedFieldOrOperatorException extends RuntimeException {

    private final String field;
    private final String operator;

    public UnsupportedFieldOrOperatorException(String field, String operator, String message) {
        super(message);
        this.field = field;
        this.operator = operator;
    }

    public static UnsupportedFieldOrOperatorException unknownField(String field) {
        return new UnsupportedFieldOrOperatorException(field, null, "Unsupported field: " + field);
    }

    public static UnsupportedFieldOrOperatorException unknownOperator(String field, String operator) {
        return new UnsupportedFieldOrOperatorException(field, operator,
                "Unsupported operator '" + operator + "' for field " + field);
    }

    public String getField() {
        return field;
    }

    public String getOperator() {
        return operator;
    }
}
