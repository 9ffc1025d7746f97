package com.cape.dispatch.cli;

import com.cape.core.model.MatchResult;
import com.cape.core.registry.CapabilityRegistry;
import com.cape.core.registry.MatcherProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: cape match "&lt;query&gt;"
 * <p>
 * Scores every registered capability against a free-text query and prints
 * the best candidates.
 */
@Command(name = "match", mixinStandardHelpOptions = true, description = "Find capabilities for a request")
@Component
public class MatchCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language request")
    private String query;

    @Option(names = {"--top", "-k"}, description = "Maximum number of results")
    private Integer topK;

    @Option(names = {"--threshold"}, description = "Minimum score")
    private Double threshold;

    private final CapabilityRegistry registry;
    private final MatcherProperties properties;

    public MatchCommand(CapabilityRegistry registry, MatcherProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<MatchResult> matches = registry.match(query,
                topK != null ? topK : properties.getTopK(),
                threshold != null ? threshold : properties.getThreshold());
        if (matches.isEmpty()) {
            ConsoleOutput.error("No capability matches: " + query);
            return;
        }
        matches.forEach(ConsoleOutput::match);
    }
}
