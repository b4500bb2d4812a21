package io.tasker4j.internal;

import io.tasker4j.core.JobCatalog;
import io.tasker4j.core.JobMessageCodec;
import io.tasker4j.core.JobPublisher;
import io.tasker4j.core.WorkerContext;
import io.tasker4j.spi.BootstrapProvider;
import io.tasker4j.spi.QueueGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point of a spawned job process.
 *
 * <pre>
 * JobBootstrap recurring &lt;jobClass&gt; [env]
 * JobBootstrap one-shot &lt;payload&gt; [env]
 * </pre>
 *
 * Exit code 0 once the job has been handed to the executor (job failures are handled there), 2 on a usage
 * or configuration error.
 */
public final class JobBootstrap {
    private static final Logger log = LoggerFactory.getLogger(JobBootstrap.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 2;

    private JobBootstrap() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Iterator<BootstrapProvider> providers = ServiceLoader.load(BootstrapProvider.class).iterator();
        if (!providers.hasNext()) {
            log.error("tasker bootstrap has no BootstrapProvider registered");
            return EXIT_USAGE;
        }
        return run(args, providers.next());
    }

    static int run(String[] args, BootstrapProvider provider) {
        if (args == null || args.length < 2 || args[1].isBlank()) {
            log.error("tasker bootstrap usage: (recurring <jobClass> | one-shot <payload>) [env]");
            return EXIT_USAGE;
        }
        String mode = args[0];
        String target = args[1];
        String env = args.length > 2 ? args[2] : "";

        JobExecutor executor;
        try {
            JobCatalog catalog = provider.jobCatalog(env);
            QueueGateway gateway = provider.queueGateway(env);
            WorkerContext context = provider.workerContext(env);
            JobMessageCodec codec = new JobMessageCodec();
            executor = new JobExecutor(catalog, codec, new JobPublisher(gateway, codec, context, Clock.systemUTC()));
        } catch (RuntimeException e) {
            log.error("tasker bootstrap configuration failed env={} msg={}", env, e.getMessage(), e);
            return EXIT_USAGE;
        }

        switch (mode) {
            case "recurring" -> executor.runRecurring(target);
            case "one-shot" -> executor.runOneShot(target);
            default -> {
                log.error("tasker bootstrap unknown mode={}", mode);
                return EXIT_USAGE;
            }
        }
        return EXIT_OK;
    }
}
