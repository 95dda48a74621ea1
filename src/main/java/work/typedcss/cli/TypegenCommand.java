package work.typedcss.cli;

import ch.qos.logback.classic.Logger;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.typedcss.api.LogLevel;
import work.typedcss.api.RunResult;
import work.typedcss.api.TransformerCommand;
import work.typedcss.api.TypegenConfiguration;
import work.typedcss.api.TypegenRunner;
import work.typedcss.config.ProjectConfig;
import work.typedcss.config.ProjectConfigLoader;
import work.typedcss.shared.DurationParser;

@CommandLine.Command(
    name = "typed-css",
    description = "Load CSS module files and print their class tokens, source locations and dependencies as JSON.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class TypegenCommand implements Callable<Integer> {
    static final String LOG_LEVEL_ENV = "TYPED_CSS_LOG_LEVEL";

    @CommandLine.Parameters(
        paramLabel = "FILE",
        arity = "1..*",
        description = "Style sheets to load, relative to --cwd."
    )
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(
        names = "--cwd",
        description = "Working directory for inputs, aliases and load paths (default: current directory).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path cwd;

    @CommandLine.Option(
        names = "--config",
        description = "Project configuration file (default: <cwd>/typed-css.toml when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configFile;

    @CommandLine.Option(
        names = {"-a", "--alias"},
        paramLabel = "KEY=DIR",
        description = "Specifier alias, e.g. --alias @=src. May be repeated."
    )
    private Map<String, String> aliases = new LinkedHashMap<>();

    @CommandLine.Option(
        names = {"-I", "--load-path"},
        paramLabel = "DIR",
        description = "Extra base directory for bare specifiers. May be repeated."
    )
    private List<Path> loadPaths = new ArrayList<>();

    @CommandLine.Option(
        names = {"-t", "--transformer"},
        paramLabel = "EXT=COMMAND",
        description = "Compiler reading the source on stdin and writing CSS to stdout, e.g. --transformer 'scss=sass --stdin'."
    )
    private Map<String, String> transformers = new LinkedHashMap<>();

    @CommandLine.Option(
        names = "--transform-timeout",
        description = "Timeout for each transformer process (e.g. 500ms, 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String transformTimeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--compact",
        description = "Print the result on a single line."
    )
    private boolean compact;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = resolveLogLevel();
        Path workingDirectory = (cwd != null ? cwd : Path.of("")).toAbsolutePath().normalize();
        ProjectConfig projectConfig = loadProjectConfig(workingDirectory);

        var builder = TypegenConfiguration.builder()
            .workingDirectory(workingDirectory)
            .logLevel(logLevel)
            .prettyOutput(!compact);
        projectConfig.applyTo(builder);
        builder.inputFiles(files);
        builder.aliases(aliases);
        builder.loadPaths(loadPaths);
        transformers.forEach((extension, command) -> builder.transformer(extension, TransformerCommand.parse(command)));
        try {
            DurationParser.parse(transformTimeoutRaw).ifPresent(builder::transformTimeout);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }

        TypegenConfiguration configuration = builder.build();
        applyLogLevel(configuration.logLevel());

        RunResult result = new TypegenRunner().run(configuration);
        spec.commandLine().getOut().println(result.toJson(configuration.prettyOutput()));
        return result.status().exitCode();
    }

    private ProjectConfig loadProjectConfig(Path workingDirectory) throws IOException {
        if (configFile != null) {
            return ProjectConfigLoader.load(workingDirectory.resolve(configFile));
        }
        return ProjectConfigLoader.findDefault(workingDirectory).orElseGet(ProjectConfig::empty);
    }

    private LogLevel resolveLogLevel() {
        String candidate = logLevelRaw;
        if (candidate == null || candidate.isBlank()) {
            candidate = System.getenv(LOG_LEVEL_ENV);
        }
        try {
            return LogLevel.from(candidate);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage(), ex);
        }
    }

    private static void applyLogLevel(LogLevel logLevel) {
        var root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof Logger logback) {
            logback.setLevel(logLevel.logbackLevel());
        }
    }
}
