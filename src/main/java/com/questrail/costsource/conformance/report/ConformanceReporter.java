package com.questrail.costsource.conformance.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.costsource.conformance.CategoryResult;
import com.questrail.costsource.conformance.ConformanceResult;
import com.questrail.costsource.conformance.TestResult;
import com.questrail.costsource.conformance.TestStatus;

import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * ConformanceReporter
 * =============================================================================
 * Renders a {@link ConformanceResult} for machines and for people.
 *
 * <h2>Structured report</h2>
 * {@link #toStructuredReport} produces JSON with stable snake_case field
 * names for CI tooling:
 * <pre>
 * {
 *   "version": "1.0.0",
 *   "plugin_name": "...",
 *   "requested_level": "Standard",
 *   "level_achieved": "Standard" | "None",
 *   "duration_ms": 1234,
 *   "summary": { "total", "passed", "failed", "skipped", "inconclusive", "text" },
 *   "categories": {
 *     "spec_validation": { "name", "attempted", "satisfied", "passed", "failed",
 *                          "skipped", "timed_out", "cancelled", "tests": [ ... ] },
 *     ...
 *   }
 * }
 * </pre>
 * Each test carries {@code name}, {@code method}, {@code level},
 * {@code status}, {@code duration_ms}, {@code error} (failed or inconclusive
 * only), {@code detail} (otherwise, when present), {@code metrics} and
 * {@code warnings}.
 *
 * <h2>Text report</h2>
 * {@link #formatReport} draws the boxed summary for a terminal.
 */
public final class ConformanceReporter
{
    public static final String LEVEL_NONE = "None";

    private static final int BOX_WIDTH = 66;

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private ConformanceReporter()
    {
    }

    public static String toStructuredReport(ConformanceResult result)
    {
        try {
            return MAPPER.writeValueAsString(toJson(result));
        }
        catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ObjectNode toJson(ConformanceResult result)
    {
        Objects.requireNonNull(result, "result");

        ObjectNode root = MAPPER.createObjectNode();
        root.put("version", result.reportVersion());
        root.put("plugin_name", result.pluginName());
        root.put("requested_level", result.requestedLevel().displayName());
        root.put("level_achieved", levelAchieved(result));
        root.put("duration_ms", result.duration().toMillis());

        ObjectNode summary = root.putObject("summary");
        summary.put("total", result.totalTests());
        summary.put("passed", result.totalPassed());
        summary.put("failed", result.totalFailed());
        summary.put("skipped", result.totalSkipped());
        summary.put("inconclusive", result.totalInconclusive());
        summary.put("text", result.summary());

        ObjectNode categories = root.putObject("categories");
        for (CategoryResult c : result.categories()) {
            categories.set(c.category().id(), category(c));
        }
        return root;
    }

    private static ObjectNode category(CategoryResult c)
    {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", c.category().displayName());
        node.put("attempted", c.attempted());
        node.put("satisfied", c.satisfied());
        node.put("passed", c.passed());
        node.put("failed", c.failed());
        node.put("skipped", c.skipped());
        node.put("timed_out", c.timedOut());
        node.put("cancelled", c.cancelled());

        ArrayNode tests = node.putArray("tests");
        for (TestResult r : c.results()) {
            tests.add(test(r));
        }
        return node;
    }

    private static ObjectNode test(TestResult r)
    {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", r.name());
        if (r.method() != null) {
            node.put("method", r.method().wireName());
        }
        node.put("level", r.level().displayName());
        node.put("status", r.status().name().toLowerCase(Locale.ROOT));
        node.put("duration_ms", r.duration().toMillis());
        if (r.hasDetail()) {
            boolean error = r.status() == TestStatus.FAILED || r.status().isInconclusive();
            node.put(error ? "error" : "detail", r.detail());
        }
        if (!r.metrics().isEmpty()) {
            ObjectNode metrics = node.putObject("metrics");
            for (Map.Entry<String, Double> m : r.metrics().entrySet()) {
                metrics.put(m.getKey(), m.getValue());
            }
        }
        if (!r.warnings().isEmpty()) {
            ArrayNode warnings = node.putArray("warnings");
            r.warnings().forEach(warnings::add);
        }
        return node;
    }

    static String levelAchieved(ConformanceResult result)
    {
        return result.achieved().map(l -> l.displayName()).orElse(LEVEL_NONE);
    }

    // ---------------------------------------------------------------------
    // Text report
    // ---------------------------------------------------------------------

    public static String formatReport(ConformanceResult result)
    {
        Objects.requireNonNull(result, "result");
        StringBuilder out = new StringBuilder("\n");

        border(out, '╔', '═', '╗');
        centered(out, "Plugin Conformance Test Report");
        border(out, '╠', '═', '╣');
        line(out, " Plugin: " + result.pluginName());
        line(out, " Level Requested: " + result.requestedLevel().displayName());
        line(out, " Level Achieved: " + levelAchieved(result));
        line(out, " Duration: " + result.duration().toMillis() + "ms");
        border(out, '╠', '═', '╣');
        line(out, " Summary");
        border(out, '╠', '─', '╣');
        line(out, "   Total:        " + result.totalTests());
        line(out, "   Passed:       " + result.totalPassed());
        line(out, "   Failed:       " + result.totalFailed());
        line(out, "   Skipped:      " + result.totalSkipped());
        line(out, "   Inconclusive: " + result.totalInconclusive());
        border(out, '╠', '═', '╣');
        line(out, " Categories");
        border(out, '╠', '─', '╣');
        for (CategoryResult c : result.categories()) {
            if (!c.attempted()) {
                line(out, String.format(Locale.ROOT, "   - %-26s not attempted", c.category().displayName()));
                continue;
            }
            line(out, String.format(Locale.ROOT, "   %s %-26s P:%3d F:%3d S:%3d I:%3d",
                    c.failed() > 0 ? "✗" : "✓", c.category().displayName(),
                    c.passed(), c.failed(), c.skipped(), c.inconclusive()));
        }
        border(out, '╠', '═', '╣');

        boolean anyProblem = false;
        for (TestResult r : result.allResults()) {
            if (r.status() == TestStatus.FAILED || r.status().isInconclusive()) {
                if (!anyProblem) {
                    line(out, " Failed and Inconclusive Tests");
                    border(out, '╠', '─', '╣');
                    anyProblem = true;
                }
                line(out, "   • " + r.name() + " [" + r.status().name().toLowerCase(Locale.ROOT) + "]");
                if (r.hasDetail()) {
                    line(out, "     Error: " + r.detail());
                }
            }
        }
        if (anyProblem) {
            border(out, '╠', '═', '╣');
        }

        centered(out, result.totalFailed() == 0 ? "✓ ALL TESTS PASSED" : "✗ SOME TESTS FAILED");
        border(out, '╚', '═', '╝');
        return out.toString();
    }

    private static void border(StringBuilder out, char left, char fill, char right)
    {
        out.append(left).append(String.valueOf(fill).repeat(BOX_WIDTH)).append(right).append('\n');
    }

    private static void line(StringBuilder out, String text)
    {
        String body = truncate(text, BOX_WIDTH);
        out.append('║').append(body).append(" ".repeat(BOX_WIDTH - body.length())).append("║\n");
    }

    private static void centered(StringBuilder out, String text)
    {
        String body = truncate(text, BOX_WIDTH);
        int left = (BOX_WIDTH - body.length()) / 2;
        line(out, " ".repeat(left) + body);
    }

    static String truncate(String s, int max)
    {
        if (s.length() <= max) {
            return s;
        }
        return s.substring(0, max - 3) + "...";
    }
}
