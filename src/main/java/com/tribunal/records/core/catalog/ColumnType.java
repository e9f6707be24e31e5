package com.tribunal.records.core.catalog;

import com.tribunal.records.exception.BadRequestException;

import java.util.Locale;

/**
 * Value types an optional catalog column can hold.
 */
public enum ColumnType {

    BOOLEAN {
        @Override
        public boolean accepts(Object value) {
            return toBoolean(value) != null;
        }

        @Override
        public Object coerce(String column, Object value) {
            if (value == null) {
                return null;
            }
            Boolean flag = toBoolean(value);
            if (flag == null) {
                throw new BadRequestException("Field " + column + " must be a boolean value");
            }
            return flag;
        }
    };

    /**
     * Tells whether a request value is a valid, non-null value of this type.
     */
    public abstract boolean accepts(Object value);

    /**
     * Converts a request value into the value bound for this column.
     * @throws BadRequestException if the value cannot represent this type
     */
    public abstract Object coerce(String column, Object value);

    private static Boolean toBoolean(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            long n = number.longValue();
            return n == 1 ? Boolean.TRUE : n == 0 ? Boolean.FALSE : null;
        }
        if (value instanceof String text) {
            switch (text.trim().toLowerCase(Locale.ROOT)) {
                case "true":
                case "1":
                    return Boolean.TRUE;
                case "false":
                case "0":
                    return Boolean.FALSE;
                default:
                    return null;
            }
        }
        return null;
    }
}
