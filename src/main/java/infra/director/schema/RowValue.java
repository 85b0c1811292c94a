package infra.director.schema;

import java.nio.charset.StandardCharsets;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.Objects;

/**
 * One scalar cell of a {@link Row}, tagged with its kind.
 */
public final class RowValue {

    public enum Kind { NULL, STRING, NUMBER, BOOLEAN, BYTES, TIME }

    private static final RowValue NULL = new RowValue(Kind.NULL, null);

    private final Kind kind;
    private final Object value;

    private RowValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static RowValue nullValue() {
        return NULL;
    }

    public static RowValue of(String value) {
        return value == null ? NULL : new RowValue(Kind.STRING, value);
    }

    public static RowValue of(Number value) {
        return value == null ? NULL : new RowValue(Kind.NUMBER, value);
    }

    public static RowValue of(Boolean value) {
        return value == null ? NULL : new RowValue(Kind.BOOLEAN, value);
    }

    /**
     * Classify a raw driver value. Temporal values keep their ISO text form;
     * unknown driver types (arrays, PGobject, UUID, ...) degrade to their string form.
     */
    public static RowValue fromDriver(Object raw) throws SQLException {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof String) {
            return new RowValue(Kind.STRING, raw);
        }
        if (raw instanceof Number) {
            return new RowValue(Kind.NUMBER, raw);
        }
        if (raw instanceof Boolean) {
            return new RowValue(Kind.BOOLEAN, raw);
        }
        if (raw instanceof byte[]) {
            byte[] bytes = (byte[]) raw;
            return new RowValue(Kind.BYTES, Arrays.copyOf(bytes, bytes.length));
        }
        if (raw instanceof Timestamp) {
            return new RowValue(Kind.TIME, ((Timestamp) raw).toInstant().toString());
        }
        if (raw instanceof java.sql.Date) {
            return new RowValue(Kind.TIME, ((java.sql.Date) raw).toLocalDate().toString());
        }
        if (raw instanceof Time) {
            return new RowValue(Kind.TIME, ((Time) raw).toLocalTime().toString());
        }
        if (raw instanceof java.util.Date) {
            return new RowValue(Kind.TIME, ((java.util.Date) raw).toInstant().toString());
        }
        if (raw instanceof TemporalAccessor) {
            return new RowValue(Kind.TIME, raw.toString());
        }
        if (raw instanceof Clob) {
            Clob clob = (Clob) raw;
            return new RowValue(Kind.STRING, clob.getSubString(1, (int) clob.length()));
        }
        if (raw instanceof Blob) {
            Blob blob = (Blob) raw;
            return new RowValue(Kind.BYTES, blob.getBytes(1, (int) blob.length()));
        }
        return new RowValue(Kind.STRING, raw.toString());
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Text form of the value; bytes are decoded as UTF-8, null stays null.
     */
    public String asString() {
        switch (kind) {
            case NULL:
                return null;
            case BYTES:
                return new String((byte[]) value, StandardCharsets.UTF_8);
            default:
                return value.toString();
        }
    }

    public Number asNumber() {
        if (kind == Kind.NUMBER) {
            return (Number) value;
        }
        if (kind == Kind.STRING || kind == Kind.BYTES) {
            try {
                return Long.parseLong(asString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Value in the shape Vert.x JSON accepts: String, Number, Boolean, byte[] (base64 on encode) or null.
     */
    public Object toJsonValue() {
        if (kind == Kind.BYTES) {
            byte[] bytes = (byte[]) value;
            return Arrays.copyOf(bytes, bytes.length);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RowValue)) return false;
        RowValue other = (RowValue) o;
        if (kind != other.kind) return false;
        if (kind == Kind.BYTES) {
            return Arrays.equals((byte[]) value, (byte[]) other.value);
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return kind == Kind.BYTES ? Arrays.hashCode((byte[]) value) : Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + ":" + asString();
    }
}
