package com.switchyard.agents;

import com.switchyard.core.errors.AgentNotFoundException;
import com.switchyard.core.errors.InvalidInputException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code cd <path> && <agent> [args]} launch lines.
 * <p>
 * Only the first {@code " && "} separates the directory from the command, so prompts may
 * contain {@code &&}. The command part is tokenized with shell quoting rules; when it is a
 * pipeline the last stage is the agent.
 */
@Component
public class AgentCommandParser {

    private static final String SEPARATOR = " && ";

    private final AgentManifest manifest;

    public AgentCommandParser(AgentManifest manifest) {
        this.manifest = manifest;
    }

    public ParsedAgentCommand parse(String commandLine) {
        int separator = commandLine.indexOf(SEPARATOR);
        if (separator < 0) {
            throw new InvalidInputException("command", "Invalid command format: " + commandLine);
        }
        String cdPart = commandLine.substring(0, separator).trim();
        String agentPart = commandLine.substring(separator + SEPARATOR.length()).trim();
        if (!cdPart.startsWith("cd ")) {
            throw new InvalidInputException("command", "Command must start with 'cd <path>': " + commandLine);
        }
        String cwd = normalizeCwd(cdPart.substring(3).trim());

        List<List<String>> stages = tokenize(agentPart);
        List<String> tokens = stages.get(stages.size() - 1);
        if (tokens.isEmpty()) {
            throw new InvalidInputException("command", "No agent command after 'cd': " + commandLine);
        }
        String agent = tokens.get(0);
        String agentId = manifest.agentIdFor(agent).orElseThrow(() -> new AgentNotFoundException(agent));
        return new ParsedAgentCommand(cwd, agent, agentId, List.copyOf(tokens.subList(1, tokens.size())));
    }

    /**
     * Strips one pair of matching surrounding quotes.
     */
    public static String normalizeCwd(String raw) {
        if (raw.length() >= 2) {
            char first = raw.charAt(0);
            char last = raw.charAt(raw.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return raw.substring(1, raw.length() - 1);
            }
        }
        return raw;
    }

    /**
     * Splits into words per pipeline stage. Quotes group words and are removed; backslash escapes
     * the next character outside single quotes.
     */
    static List<List<String>> tokenize(String input) {
        List<List<String>> stages = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        boolean inWord = false;
        char quote = 0;

        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (quote == '\'') {
                if (c == '\'') {
                    quote = 0;
                } else {
                    word.append(c);
                }
            } else if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else if (c == '\\' && i + 1 < input.length() && "\"\\$`".indexOf(input.charAt(i + 1)) >= 0) {
                    word.append(input.charAt(++i));
                } else {
                    word.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inWord = true;
            } else if (c == '\\' && i + 1 < input.length()) {
                word.append(input.charAt(++i));
                inWord = true;
            } else if (Character.isWhitespace(c)) {
                if (inWord) {
                    current.add(word.toString());
                    word.setLength(0);
                    inWord = false;
                }
            } else if (c == '|') {
                if (inWord) {
                    current.add(word.toString());
                    word.setLength(0);
                    inWord = false;
                }
                stages.add(current);
                current = new ArrayList<>();
            } else {
                word.append(c);
                inWord = true;
            }
        }
        if (quote != 0) {
            throw new InvalidInputException("command", "Unterminated quote in: " + input);
        }
        if (inWord) {
            current.add(word.toString());
        }
        stages.add(current);
        return stages;
    }
}
