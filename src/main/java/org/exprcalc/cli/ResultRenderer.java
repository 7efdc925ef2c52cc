package org.exprcalc.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.exprcalc.api.Calculation;
import org.exprcalc.api.CalculationError;
import org.exprcalc.api.Value;
import org.exprcalc.frontend.postfix.RpnElement;
import org.exprcalc.registry.OperationRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns calculation outcomes into the text printed by the command line.
 */
public final class ResultRenderer {

    // integral values below this magnitude are printed without a fractional part
    private static final double PLAIN_INTEGER_LIMIT = 1e16;
    private static final long NEGATIVE_ZERO_BITS = Double.doubleToRawLongBits(-0.0);

    private final Gson gson = new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .create();

    /**
     * Formats a value for humans: booleans as {@code true}/{@code false}, integral numbers
     * without a fractional part, everything else in the shortest decimal form.
     *
     * @param value The value.
     * @return The text.
     */
    public static String format(Value value) {
        if (value instanceof Value.Bool bool) {
            return Boolean.toString(bool.value());
        }
        double number = value.asNumber();
        if (Double.isNaN(number)) {
            return "nan";
        }
        if (Double.isInfinite(number)) {
            return number > 0 ? "inf" : "-inf";
        }
        if (Double.doubleToRawLongBits(number) == NEGATIVE_ZERO_BITS) {
            return "-0";
        }
        if (number == Math.rint(number) && Math.abs(number) < PLAIN_INTEGER_LIMIT) {
            return Long.toString((long) number);
        }
        return Double.toString(number).replace('E', 'e');
    }

    /**
     * @param postfix The postfix stream.
     * @return The elements separated by single spaces.
     */
    public static String formatPostfix(List<RpnElement> postfix) {
        return postfix.stream()
                .map(ResultRenderer::formatElement)
                .collect(Collectors.joining(" "));
    }

    /**
     * Lists a registry for humans: one {@code name = value} line per constant, then one
     * {@code name(arity)} line per function.
     *
     * @param registry The registry.
     * @return The lines, constants first.
     */
    public static List<String> formatRegistry(OperationRegistry registry) {
        List<String> lines = new ArrayList<>();
        for (String name : registry.constantNames()) {
            lines.add(name + " = " + format(Value.of(registry.constant(name).orElseThrow())));
        }
        for (String name : registry.functionNames()) {
            lines.add(name + "(" + registry.function(name).orElseThrow().arity() + ")");
        }
        return lines;
    }

    /**
     * Renders a registry as a JSON object with a {@code constants} and a {@code functions} member.
     *
     * @param registry The registry.
     * @return The JSON text.
     */
    public String registryToJson(OperationRegistry registry) {
        JsonObject constants = new JsonObject();
        registry.constantNames().forEach(name -> constants.addProperty(name, registry.constant(name).orElseThrow()));
        JsonObject functions = new JsonObject();
        registry.functionNames().forEach(name ->
                functions.addProperty(name, registry.function(name).orElseThrow().arity().toString()));
        JsonObject root = new JsonObject();
        root.add("constants", constants);
        root.add("functions", functions);
        return gson.toJson(root);
    }

    private static String formatElement(RpnElement element) {
        if (element instanceof RpnElement.Literal literal) {
            return format(literal.value());
        }
        return element.toString();
    }

    /**
     * Renders one invocation as a JSON object.
     *
     * @param expression The expression as given.
     * @param result The outcome.
     * @param postfix The postfix stream, or {@code null} if it was not requested or not available.
     * @return The JSON text.
     */
    public String toJson(String expression, Calculation<Value> result, List<RpnElement> postfix) {
        JsonObject root = new JsonObject();
        root.addProperty("expression", expression);
        if (postfix != null) {
            JsonArray elements = new JsonArray();
            postfix.forEach(element -> elements.add(formatElement(element)));
            root.add("postfix", elements);
        }
        if (result.isSuccess()) {
            Value value = result.value();
            if (value instanceof Value.Bool bool) {
                root.addProperty("value", bool.value());
            } else {
                root.addProperty("value", value.asNumber());
            }
        } else {
            CalculationError error = result.error();
            JsonObject errorObject = new JsonObject();
            errorObject.addProperty("code", error.code().name());
            errorObject.addProperty("message", error.message());
            if (error.column() > 0) {
                errorObject.addProperty("column", error.column());
            }
            root.add("error", errorObject);
        }
        return gson.toJson(root);
    }
}
