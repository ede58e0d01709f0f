package io.github.simbo1905.tryharness;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/// Renders arbitrary values for failure reports.
///
/// A value is printable when its class supplies its own text: it overrides
/// `toString()` somewhere below `Object`, or it is an array. The three outcomes are:
/// - printable: `"<text>" (<type name>)`
/// - not printable, or `toString()` threw: `[Can't print] (<type name>)`
/// - `null`: `"nullptr" (nullptr_t)`
///
/// [#render(Object)] never throws for a non-null renderer.
///
/// The type name style defaults to the system property `tryharness.renderer.typenames`
/// (`qualified` or `simple`), read once when the class is loaded.
public final class ValueRenderer {

    private static final Logger LOG = Logger.getLogger(ValueRenderer.class.getName());

    /// System property selecting the default [TypeNames] style.
    public static final String TYPE_NAMES_PROPERTY = "tryharness.renderer.typenames";

    static final String NULL_RENDERING = "\"nullptr\" (nullptr_t)";
    static final String CANT_PRINT = "[Can't print]";

    /// How the type name in parentheses is written.
    public enum TypeNames {
        /// `Class.getName()`, for example `java.lang.Integer`
        QUALIFIED,
        /// `Class.getSimpleName()`, for example `Integer`; anonymous and hidden classes keep the qualified name
        SIMPLE
    }

    private static final TypeNames DEFAULT_TYPE_NAMES = TypeNames.QUALIFIED;
    private static final TypeNames CONFIGURED_TYPE_NAMES;

    static {
        CONFIGURED_TYPE_NAMES = parseTypeNames(System.getProperty(TYPE_NAMES_PROPERTY));
    }

    /// Parses a type name style, ignoring surrounding blanks and case.
    /// @param propertyValue the raw property value, possibly null
    /// @return the parsed style, or the default when the value is null or unrecognised
    static TypeNames parseTypeNames(String propertyValue) {
        if (propertyValue == null) {
            return DEFAULT_TYPE_NAMES;
        }
        final String normalized = propertyValue.trim().toUpperCase(Locale.ROOT);
        try {
            final TypeNames typeNames = TypeNames.valueOf(normalized);
            LOG.fine(() -> "Renderer type names set to " + normalized + " via system property");
            return typeNames;
        } catch (IllegalArgumentException e) {
            LOG.warning(() -> "Invalid renderer type names: " + propertyValue
                    + ". Using default: " + DEFAULT_TYPE_NAMES);
            return DEFAULT_TYPE_NAMES;
        }
    }

    private static final ClassValue<Boolean> PRINTABLE = new ClassValue<>() {
        @Override
        protected Boolean computeValue(Class<?> type) {
            return probePrintable(type);
        }
    };

    private final TypeNames typeNames;

    /// Creates a renderer using the configured type name style.
    public ValueRenderer() {
        this(CONFIGURED_TYPE_NAMES);
    }

    /// Creates a renderer with an explicit type name style.
    /// @param typeNames the type name style
    public ValueRenderer(TypeNames typeNames) {
        this.typeNames = Objects.requireNonNull(typeNames, "typeNames must not be null");
    }

    /// @return the type name style read from the system property, or the default
    public static TypeNames configuredTypeNames() {
        return CONFIGURED_TYPE_NAMES;
    }

    /// @return the type name style of this renderer
    public TypeNames typeNames() {
        return typeNames;
    }

    /// Renders one value.
    /// @param value any value, including `null`
    /// @return the diagnostic text, without a line terminator
    public String render(Object value) {
        if (value == null) {
            return NULL_RENDERING;
        }
        final Class<?> type = value.getClass();
        final String name = typeName(type);
        if (!isPrintable(type)) {
            return CANT_PRINT + " (" + name + ")";
        }
        try {
            return "\"" + text(value) + "\" (" + name + ")";
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            LOG.fine(() -> "toString() of " + name + " threw " + e.getClass().getName());
            return CANT_PRINT + " (" + name + ")";
        }
    }

    /// Whether values of this class supply their own text.
    /// @param type a runtime class
    /// @return true for arrays and for classes overriding `toString()`
    public static boolean isPrintable(Class<?> type) {
        Objects.requireNonNull(type, "type must not be null");
        return PRINTABLE.get(type);
    }

    String typeName(Class<?> type) {
        if (typeNames == TypeNames.SIMPLE) {
            final String simple = type.getSimpleName();
            if (!simple.isEmpty() && !type.isHidden()) {
                return simple;
            }
        }
        return type.getName();
    }

    private static boolean probePrintable(Class<?> type) {
        if (type.isArray()) {
            return true;
        }
        try {
            return type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException e) {
            LOG.warning(() -> "No toString() found on " + type.getName() + ", treating it as not printable");
            return false;
        }
    }

    private static String text(Object value) {
        if (!value.getClass().isArray()) {
            return String.valueOf(value);
        }
        if (value instanceof Object[] objects) {
            return Arrays.deepToString(objects);
        } else if (value instanceof int[] ints) {
            return Arrays.toString(ints);
        } else if (value instanceof long[] longs) {
            return Arrays.toString(longs);
        } else if (value instanceof double[] doubles) {
            return Arrays.toString(doubles);
        } else if (value instanceof float[] floats) {
            return Arrays.toString(floats);
        } else if (value instanceof short[] shorts) {
            return Arrays.toString(shorts);
        } else if (value instanceof byte[] bytes) {
            return Arrays.toString(bytes);
        } else if (value instanceof char[] chars) {
            return Arrays.toString(chars);
        } else {
            return Arrays.toString((boolean[]) value);
        }
    }
}
