package infix.model;

import infix.InternalCompilerError;
import org.apache.commons.io.IOUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 *
 * The immutable lookup of every operator the compiler recognises, together with the
 * lambda arrow and the names of functions that take operators as literal arguments.
 *
 * <p>A symbol is an operator if and only if this table has a spec for it. Anything else,
 * including tags some other table might know, is an ordinary identifier.</p>
 *
 * <p>The default table is data: it is read once from the classpath resource
 * {@value #DEFAULT_TABLE_RESOURCE}. Other tables can be loaded from JSON documents of
 * the same shape or assembled with a {@link Builder}.</p>
 *
 */
public final class OperatorTable {

	public static final String DEFAULT_TABLE_RESOURCE = "/infix/operators.json";
	public static final String DEFAULT_LAMBDA_ARROW = "=>";

	private static final Logger logger = Logger.getLogger("Infix Operators");

	private final Map<String, OperatorSpec> specs;
	private final Set<String> literalArgumentFunctions;
	private final String lambdaArrow;

	private OperatorTable(Map<String, OperatorSpec> specs, Set<String> literalArgumentFunctions, String lambdaArrow) {
		this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
		this.literalArgumentFunctions = Collections.unmodifiableSet(new LinkedHashSet<>(literalArgumentFunctions));
		this.lambdaArrow = lambdaArrow;
	}

	private static final class DefaultTableHolder {
		static final OperatorTable INSTANCE = loadDefault();
	}

	public static OperatorTable defaultTable() {
		return DefaultTableHolder.INSTANCE;
	}

	private static OperatorTable loadDefault() {
		try (InputStream in = OperatorTable.class.getResourceAsStream(DEFAULT_TABLE_RESOURCE)) {
			if (in == null) {
				throw new InternalCompilerError("missing classpath resource " + DEFAULT_TABLE_RESOURCE);
			}
			OperatorTable table = load(in);
			logger.config("Loaded default operator table with " + table.getOperators().size() + " operators");
			return table;
		} catch (IOException e) {
			throw new InternalCompilerError(e);
		}
	}

	/**
	 * Reads a table from a UTF-8 JSON document.
	 */
	public static OperatorTable load(InputStream in) throws IOException {
		String document = IOUtils.toString(in, StandardCharsets.UTF_8);
		final JSONObject json;
		try {
			json = new JSONObject(document);
		} catch (JSONException e) {
			throw new InvalidOperatorTableIssue("not a JSON object", e);
		}
		return fromJSON(json);
	}

	public static OperatorTable fromJSON(JSONObject json) {
		Builder builder = new Builder();
		try {
			builder.lambdaArrow(json.optString("lambdaArrow", DEFAULT_LAMBDA_ARROW));
			JSONArray functions = json.optJSONArray("literalArgumentFunctions");
			if (functions != null) {
				for (int i = 0; i < functions.length(); i++) {
					builder.literalArgumentFunction(functions.getString(i));
				}
			}
			JSONArray operators = json.getJSONArray("operators");
			for (int i = 0; i < operators.length(); i++) {
				builder.operator(specFromJSON(operators.getJSONObject(i)));
			}
		} catch (JSONException e) {
			throw new InvalidOperatorTableIssue(e.getMessage(), e);
		}
		return builder.build();
	}

	private static OperatorSpec specFromJSON(JSONObject json) {
		String tag = json.getString("tag");
		BigDecimal precedence = json.getBigDecimal("precedence");
		Associativity associativity = enumValue(Associativity.class, tag, json.optString("associativity", "left"));
		ArityClass arityClass = enumValue(ArityClass.class, tag, json.optString("arity", "binary"));
		switch (arityClass) {
			case UNARY:
				return OperatorSpec.unary(tag, precedence, associativity);
			case BINARY:
				return OperatorSpec.binary(tag, precedence, associativity);
			case THREADING:
				if (!json.has("direction")) {
					throw new InvalidOperatorTableIssue("threading operator " + tag + " has no direction");
				}
				ThreadingDirection direction = enumValue(ThreadingDirection.class, tag, json.getString("direction"));
				return OperatorSpec.threading(tag, precedence, associativity, direction, json.optBoolean("nilSafe", false));
			default:
				throw new InternalCompilerError("unhandled arity class " + arityClass);
		}
	}

	private static <T extends Enum<T>> T enumValue(Class<T> type, String tag, String value) {
		try {
			return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new InvalidOperatorTableIssue("operator " + tag + " has invalid " +
					type.getSimpleName() + " \"" + value + "\"", e);
		}
	}

	public boolean isOperator(String tag) {
		return specs.containsKey(tag);
	}

	/**
	 * @return the spec for tag, or null if tag is not an operator
	 */
	public OperatorSpec getSpec(String tag) {
		return specs.get(tag);
	}

	public BigDecimal precedence(String tag) {
		OperatorSpec spec = specs.get(tag);
		return spec == null ? BigDecimal.ZERO : spec.getPrecedence();
	}

	public Associativity associativity(String tag) {
		OperatorSpec spec = specs.get(tag);
		return spec == null ? Associativity.LEFT : spec.getAssociativity();
	}

	/**
	 * @return the arity class of tag, or null if tag is not an operator
	 */
	public ArityClass arityClass(String tag) {
		OperatorSpec spec = specs.get(tag);
		return spec == null ? null : spec.getArityClass();
	}

	public boolean isLiteralArgumentFunction(String name) {
		return literalArgumentFunctions.contains(name);
	}

	public String getLambdaArrow() {
		return lambdaArrow;
	}

	public boolean isLambdaArrow(String name) {
		return lambdaArrow.equals(name);
	}

	public Map<String, OperatorSpec> getOperators() {
		return specs;
	}

	public Set<String> getLiteralArgumentFunctions() {
		return literalArgumentFunctions;
	}

	/**
	 * @return a builder seeded with this table's contents
	 */
	public Builder toBuilder() {
		Builder builder = new Builder().lambdaArrow(lambdaArrow);
		specs.values().forEach(builder::operator);
		literalArgumentFunctions.forEach(builder::literalArgumentFunction);
		return builder;
	}

	public static final class Builder {
		private final Map<String, OperatorSpec> specs = new LinkedHashMap<>();
		private final Set<String> literalArgumentFunctions = new LinkedHashSet<>();
		private String lambdaArrow = DEFAULT_LAMBDA_ARROW;

		/**
		 * Adds spec, replacing any operator with the same tag.
		 */
		public Builder operator(OperatorSpec spec) {
			specs.put(spec.getTag(), spec);
			return this;
		}

		public Builder unary(String tag, String precedence) {
			return operator(OperatorSpec.unary(tag, new BigDecimal(precedence), Associativity.RIGHT));
		}

		public Builder binary(String tag, String precedence, Associativity associativity) {
			return operator(OperatorSpec.binary(tag, new BigDecimal(precedence), associativity));
		}

		public Builder threading(String tag, String precedence, ThreadingDirection direction, boolean nilSafe) {
			return operator(OperatorSpec.threading(tag, new BigDecimal(precedence), Associativity.LEFT, direction, nilSafe));
		}

		public Builder remove(String tag) {
			specs.remove(tag);
			return this;
		}

		public Builder literalArgumentFunction(String name) {
			literalArgumentFunctions.add(name);
			return this;
		}

		public Builder lambdaArrow(String lambdaArrow) {
			this.lambdaArrow = lambdaArrow;
			return this;
		}

		public OperatorTable build() {
			if (lambdaArrow == null || lambdaArrow.isEmpty()) {
				throw new InvalidOperatorTableIssue("lambda arrow must not be empty");
			}
			if (specs.containsKey(lambdaArrow)) {
				throw new InvalidOperatorTableIssue("lambda arrow " + lambdaArrow + " is also declared as an operator");
			}
			for (String name : literalArgumentFunctions) {
				if (specs.containsKey(name)) {
					throw new InvalidOperatorTableIssue("literal-argument function " + name + " is also declared as an operator");
				}
			}
			return new OperatorTable(specs, literalArgumentFunctions, lambdaArrow);
		}
	}
}
