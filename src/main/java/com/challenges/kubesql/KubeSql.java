package com.challenges.kubesql;

import com.challenges.kubesql.config.ContextValidator;
import com.challenges.kubesql.config.Kubeconfig;
import com.challenges.kubesql.config.KubeconfigParser;
import com.challenges.kubesql.execution.KubectlResourceLister;
import com.challenges.kubesql.execution.QueryExecutor;
import com.challenges.kubesql.execution.QueryResult;
import com.challenges.kubesql.execution.ResourceLister;
import com.challenges.kubesql.output.PlanFormatter;
import com.challenges.kubesql.output.TableFormatter;
import com.challenges.kubesql.query.QueryPlan;
import com.challenges.kubesql.query.SqlQueryParser;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;

@Command(name = "kubesql", mixinStandardHelpOptions = true, version = "1.0",
         description = "Query Kubernetes resources across contexts and namespaces with SQL")
public class KubeSql implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(KubeSql.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1",
                description = "SELECT <namespaces> FROM <contexts> WHERE <kind.field.path> = '<value>' ...")
    private String query;

    @Option(names = {"-f", "--file"}, description = "Read the query from a file")
    private File queryFile;

    @Option(names = "--kubeconfig", description = "Kubeconfig file (default: $KUBECONFIG or ~/.kube/config)")
    private String kubeconfig;

    @Option(names = "--kubectl", defaultValue = "kubectl", description = "kubectl binary (default: ${DEFAULT-VALUE})")
    private String kubectl;

    @Option(names = {"-e", "--explain"}, description = "Print the query plan as JSON instead of running it")
    private boolean explain = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact --explain output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-v", "--verbose"}, description = "Log debug output to stderr")
    private boolean verbose = false;

    private final BiFunction<String, String, ResourceLister> listerFactory;

    public KubeSql() {
        this(KubectlResourceLister::new);
    }

    KubeSql(BiFunction<String, String, ResourceLister> listerFactory) {
        this.listerFactory = listerFactory;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new KubeSql()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            Configurator.setRootLevel(Level.DEBUG);
        }
        try {
            QueryPlan plan = new SqlQueryParser().parse(readQuery());

            if (explain) {
                spec.commandLine().getOut().println(new PlanFormatter(!compactOutput).format(plan));
                return 0;
            }

            ContextValidator.validateContexts(loadKubeconfig(), plan.contexts());

            QueryExecutor executor = new QueryExecutor(listerFactory.apply(kubectl, kubeconfig));
            QueryResult result = executor.execute(plan);
            spec.commandLine().getOut().print(new TableFormatter().format(result));
            return 0;
        } catch (KubeSqlException e) {
            LOG.debug("Query failed", e);
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        } finally {
            spec.commandLine().getOut().flush();
            spec.commandLine().getErr().flush();
        }
    }

    private String readQuery() throws KubeSqlException {
        if (queryFile != null && query != null) {
            throw new KubeSqlException("Give the query either as an argument or with --file, not both");
        }
        if (queryFile == null) {
            if (query == null) {
                throw new KubeSqlException("No query given");
            }
            return query;
        }
        try {
            return Files.readString(queryFile.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new KubeSqlException("Unable to read query file " + queryFile + ": " + e.getMessage(), e);
        }
    }

    private Kubeconfig loadKubeconfig() throws KubeSqlException {
        KubeconfigParser parser = new KubeconfigParser();
        return parser.read(KubeconfigParser.locate(kubeconfig, System.getenv("KUBECONFIG"),
                Path.of(System.getProperty("user.home"))));
    }
}
