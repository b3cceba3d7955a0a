package com.resource.generator.option;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import com.resource.generator.model.OperationId;
import com.resource.generator.model.Selector;

/**
 * Parses the textual selector forms accepted on the command line.
 *
 * <pre>
 *   (blank) | all | read | read_write | only:a,b | except:a,b
 * </pre>
 */
public class SelectorParser {

    private static final String ONLY_PREFIX = "only:";
    private static final String EXCEPT_PREFIX = "except:";

    public Selector parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Selector.all();
        }
        String text = raw.trim();
        String lower = text.toLowerCase(Locale.ROOT);

        if (lower.startsWith(ONLY_PREFIX)) {
            return Selector.only(parseIds(text.substring(ONLY_PREFIX.length()), raw));
        }
        if (lower.startsWith(EXCEPT_PREFIX)) {
            return Selector.except(parseIds(text.substring(EXCEPT_PREFIX.length()), raw));
        }

        return switch (lower) {
            case "all" -> Selector.all();
            case "read" -> Selector.read();
            case "read_write", "read-write" -> Selector.readWrite();
            default -> throw new InvalidSelectorException("Unrecognized selector '" + raw
                    + "'. Expected all, read, read_write, only:<ids> or except:<ids>");
        };
    }

    /**
     * Parses a comma-separated id list such as {@code create,update!}.
     */
    public List<OperationId> parseIds(String list) {
        return parseIds(list, list);
    }

    private List<OperationId> parseIds(String list, String raw) {
        List<String> tokens = Arrays.stream(list.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        if (tokens.isEmpty()) {
            throw new InvalidSelectorException("Selector '" + raw + "' lists no operations");
        }

        List<OperationId> ids = new ArrayList<>();
        for (String token : tokens) {
            if (!OperationId.isValid(token)) {
                throw new InvalidSelectorException("Invalid operation id '" + token + "' in selector '" + raw + "'");
            }
            ids.add(OperationId.of(token));
        }
        return ids;
    }
}
