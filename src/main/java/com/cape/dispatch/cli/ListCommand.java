package com.cape.dispatch.cli;

import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.ExecutionType;
import com.cape.core.registry.CapabilityRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Locale;

/**
 * CLI command: cape list [--type TYPE] [--tag TAG]
 */
@Command(name = "list", mixinStandardHelpOptions = true, description = "List registered capabilities")
@Component
public class ListCommand implements Runnable {

    @Option(names = {"--type", "-t"}, description = "Only this execution type: tool, generative, code, workflow, hybrid")
    private String type;

    @Option(names = {"--tag"}, description = "Only capabilities carrying this tag")
    private String tag;

    private final CapabilityRegistry registry;

    public ListCommand(CapabilityRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<CapabilityDescriptor> capabilities;
        try {
            capabilities = type != null ? registry.byType(ExecutionType.parse(type)) : registry.list();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        if (tag != null) {
            capabilities = capabilities.stream()
                    .filter(d -> d.tags().stream().anyMatch(t -> t.equalsIgnoreCase(tag)))
                    .toList();
        }
        if (capabilities.isEmpty()) {
            ConsoleOutput.info("No capabilities registered");
            return;
        }
        for (CapabilityDescriptor d : capabilities) {
            ConsoleOutput.capability(d.id(), d.executionType().name().toLowerCase(Locale.ROOT), d.description());
        }
        System.out.println("──────────────────────────────────");
        ConsoleOutput.info(capabilities.size() + " of " + registry.size() + " capabilities");
    }
}
