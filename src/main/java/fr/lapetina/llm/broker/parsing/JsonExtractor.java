package fr.lapetina.llm.broker.parsing;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the JSON payload inside free-form model output.
 */
public final class JsonExtractor {

    private static final Pattern FENCED = Pattern.compile("```(?:json|JSON)?\\s*\\n?(.*?)```", Pattern.DOTALL);

    private JsonExtractor() {
    }

    /**
     * Returns the first fenced code block holding a JSON value, otherwise the span from the first
     * opening brace or bracket to the last matching closer.
     *
     * @throws OutputDecodingException if the text holds no JSON object or array
     */
    public static String extract(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new OutputDecodingException("Empty model output");
        }

        Matcher fenced = FENCED.matcher(rawText);
        while (fenced.find()) {
            String block = fenced.group(1).trim();
            if (block.startsWith("{") || block.startsWith("[")) {
                return block;
            }
        }

        int object = rawText.indexOf('{');
        int array = rawText.indexOf('[');
        int start;
        char closer;
        if (object >= 0 && (array < 0 || object < array)) {
            start = object;
            closer = '}';
        } else if (array >= 0) {
            start = array;
            closer = ']';
        } else {
            throw new OutputDecodingException("No JSON object or array found in model output");
        }

        int end = rawText.lastIndexOf(closer);
        if (end < start) {
            throw new OutputDecodingException("Unterminated JSON value in model output");
        }
        return rawText.substring(start, end + 1);
    }
}
