package org.dxworks.fortranframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.fortranframe.export.OutputFormat;
import org.dxworks.fortranframe.model.NodePath;
import org.dxworks.fortranframe.parser.StatementInterceptor;
import org.dxworks.fortranframe.parser.StatementInterceptors;
import org.dxworks.fortranframe.rewrite.PrunePasses;
import org.dxworks.fortranframe.rewrite.PruneSequence;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public class FortranframeConfig {

    private static final String CONFIG_FILE_NAME = "fortranframe-config.yml";
    private static final OutputFormat DEFAULT_OUTPUT_FORMAT = OutputFormat.TEXT;
    private static final Level DEFAULT_LOG_LEVEL = Level.WARNING;

    private final OutputFormat outputFormat;
    private final List<String> select;
    private final boolean pruneUsing;
    private final boolean pruneEmptyLoops;
    private final List<String> pruneAssignmentTargets;
    private final List<String> discardStatements;
    private final Level logLevel;

    private FortranframeConfig(OutputFormat outputFormat, List<String> select, boolean pruneUsing,
                               boolean pruneEmptyLoops, List<String> pruneAssignmentTargets,
                               List<String> discardStatements, Level logLevel) {
        this.outputFormat = outputFormat;
        this.select = List.copyOf(select);
        this.pruneUsing = pruneUsing;
        this.pruneEmptyLoops = pruneEmptyLoops;
        this.pruneAssignmentTargets = List.copyOf(pruneAssignmentTargets);
        this.discardStatements = List.copyOf(discardStatements);
        this.logLevel = logLevel;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public List<String> getSelect() {
        return select;
    }

    public NodePath getSelectPath() {
        return NodePath.parse(select);
    }

    public boolean isPruneUsing() {
        return pruneUsing;
    }

    public boolean isPruneEmptyLoops() {
        return pruneEmptyLoops;
    }

    public List<String> getPruneAssignmentTargets() {
        return pruneAssignmentTargets;
    }

    public List<String> getDiscardStatements() {
        return discardStatements;
    }

    public Level getLogLevel() {
        return logLevel;
    }

    public List<StatementInterceptor> interceptors() {
        return StatementInterceptors.defaultsPlus(discardStatements);
    }

    /** Passes run in a fixed order: using statements, assignment targets, then empty loops. */
    public PruneSequence pruneSequence(Logger logger) {
        PruneSequence sequence = new PruneSequence(logger);
        if (pruneUsing) {
            sequence.add("using", PrunePasses.usingStatements());
        }
        for (String target : pruneAssignmentTargets) {
            sequence.add("assignments to " + target, PrunePasses.assignmentsTo(target));
        }
        if (pruneEmptyLoops) {
            sequence.add("empty loops", PrunePasses.emptyLoops());
        }
        return sequence;
    }

    public static FortranframeConfig load(Logger logger) {
        return load(Paths.get(CONFIG_FILE_NAME), logger);
    }

    public static FortranframeConfig load(Path configPath, Logger logger) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig, logger);
            }
        } catch (IOException e) {
            logger.warning("Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    private static FortranframeConfig fromYaml(YamlConfig yamlConfig, Logger logger) {
        OutputFormat effectiveFormat = DEFAULT_OUTPUT_FORMAT;
        if (yamlConfig.outputFormat != null) {
            effectiveFormat = OutputFormat.fromName(yamlConfig.outputFormat).orElseGet(() -> {
                logger.warning("Unknown outputFormat '" + yamlConfig.outputFormat + "', using " + DEFAULT_OUTPUT_FORMAT);
                return DEFAULT_OUTPUT_FORMAT;
            });
        }

        Level effectiveLevel = DEFAULT_LOG_LEVEL;
        if (yamlConfig.logLevel != null) {
            try {
                effectiveLevel = Level.parse(yamlConfig.logLevel.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                logger.warning("Unknown logLevel '" + yamlConfig.logLevel + "', using " + DEFAULT_LOG_LEVEL);
            }
        }

        PruneConfig prune = yamlConfig.prune != null ? yamlConfig.prune : new PruneConfig();
        return new FortranframeConfig(
                effectiveFormat,
                orEmpty(yamlConfig.select),
                Boolean.TRUE.equals(prune.using),
                Boolean.TRUE.equals(prune.emptyLoops),
                orEmpty(prune.assignmentTargets),
                orEmpty(yamlConfig.discardStatements),
                effectiveLevel);
    }

    public static FortranframeConfig defaults() {
        return new FortranframeConfig(DEFAULT_OUTPUT_FORMAT, List.of(), false, false, List.of(), List.of(),
                DEFAULT_LOG_LEVEL);
    }

    public static FortranframeConfig with(OutputFormat outputFormat, List<String> select, boolean pruneUsing,
                                          boolean pruneEmptyLoops, List<String> pruneAssignmentTargets,
                                          List<String> discardStatements) {
        return new FortranframeConfig(
                outputFormat != null ? outputFormat : DEFAULT_OUTPUT_FORMAT,
                select, pruneUsing, pruneEmptyLoops, pruneAssignmentTargets, discardStatements,
                DEFAULT_LOG_LEVEL);
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }

    private static class YamlConfig {
        public String outputFormat;
        public List<String> select;
        public PruneConfig prune;
        public List<String> discardStatements;
        public String logLevel;
    }

    private static class PruneConfig {
        public Boolean using;
        public Boolean emptyLoops;
        public List<String> assignmentTargets;
    }
}
