/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.hybridnet.api.networking.model.network.Network;
import io.hybridnet.api.networking.model.remotecluster.RemoteCluster;
import io.hybridnet.api.networking.model.subnet.Subnet;
import io.hybridnet.operator.cluster.leaderelection.LeaderElectionManager;
import io.hybridnet.operator.cluster.operator.remotecluster.RemoteClusterController;
import io.hybridnet.operator.cluster.operator.remotecluster.session.KubernetesRemoteClusterSessionFactory;
import io.hybridnet.operator.cluster.operator.resource.kubernetes.InformerResourceCache;
import io.hybridnet.operator.cluster.operator.resource.kubernetes.KubernetesClusterUuidResolver;
import io.hybridnet.operator.cluster.operator.resource.kubernetes.KubernetesEventRecorder;
import io.hybridnet.operator.cluster.operator.resource.kubernetes.KubernetesRemoteClusterStore;
import io.hybridnet.operator.common.MetricsProvider;
import io.hybridnet.operator.common.MicrometerMetricsProvider;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.vertx.core.Context;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * The main class used to start the Hybridnet Remote Cluster Operator
 */
@SuppressFBWarnings("DM_EXIT")
public class Main {
    private static final Logger LOGGER = LogManager.getLogger(Main.class.getName());

    private static final int HEALTH_SERVER_PORT = 8080;
    private static final long SHUTDOWN_TIMEOUT = 10_000L;

    /**
     * The main method used to run the Remote Cluster Operator
     *
     * @param args  The command line arguments
     */
    public static void main(String[] args) {
        final String version = Main.class.getPackage().getImplementationVersion();
        LOGGER.info("RemoteClusterOperator {} is starting", version);
        RemoteClusterOperatorConfig config = RemoteClusterOperatorConfig.buildFromMap(System.getenv());
        LOGGER.info("Remote Cluster Operator configuration is {}", config);

        // Shutdown hook to register shutdown actions
        ShutdownHook shutdownHook = new ShutdownHook();
        Runtime.getRuntime().addShutdownHook(new Thread(shutdownHook));

        Vertx vertx = Vertx.vertx();
        shutdownHook.register(() -> ShutdownHook.shutdownVertx(vertx, SHUTDOWN_TIMEOUT));

        MetricsProvider metricsProvider = new MicrometerMetricsProvider(prometheusRegistry());
        KubernetesClient client = new KubernetesClientBuilder().build();
        shutdownHook.register(client::close);

        RemoteClusterController controller = createController(vertx, client, config, metricsProvider);

        startHealthServer(vertx, metricsProvider, controller)
                .compose(i -> leaderElection(client, config, shutdownHook))
                .compose(i -> deployRemoteClusterOperator(vertx, controller, shutdownHook))
                .onComplete(res -> {
                    if (res.failed())   {
                        LOGGER.error("Unable to start the Remote Cluster Operator", res.cause());
                        vertx.executeBlocking(() -> {
                            System.exit(1);
                            return true;
                        });
                    }
                });
    }

    private static PrometheusMeterRegistry prometheusRegistry() {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        return registry;
    }

    /**
     * Creates the remote cluster controller and its Kubernetes based collaborators
     *
     * @param vertx             Vertx instance
     * @param client            Kubernetes client instance
     * @param config            Operator configuration
     * @param metricsProvider   Metrics provider instance
     *
     * @return  Controller which is not started yet
     */
    static RemoteClusterController createController(Vertx vertx, KubernetesClient client, RemoteClusterOperatorConfig config, MetricsProvider metricsProvider) {
        InformerResourceCache<RemoteCluster> remoteClusters = InformerResourceCache.create(client, RemoteCluster.class, config.getInformerResyncMs());
        InformerResourceCache<Network> networks = InformerResourceCache.create(client, Network.class, config.getInformerResyncMs());
        InformerResourceCache<Subnet> subnets = InformerResourceCache.create(client, Subnet.class, config.getInformerResyncMs());

        String identity = config.getLeaderElectionConfig() != null
                ? config.getLeaderElectionConfig().identity()
                : System.getenv().getOrDefault("HOSTNAME", RemoteClusterController.CONTROLLER_NAME);

        return new RemoteClusterController(
                config,
                vertx,
                new KubernetesClusterUuidResolver(client),
                remoteClusters,
                networks,
                subnets,
                new KubernetesRemoteClusterStore(client, remoteClusters),
                new KubernetesRemoteClusterSessionFactory(),
                new KubernetesEventRecorder(client, RemoteClusterController.CONTROLLER_NAME, identity, Clock.systemUTC()),
                metricsProvider,
                Clock.systemUTC());
    }

    /**
     * Deploys the verticle running the remote cluster controller
     *
     * @param vertx         Vertx instance
     * @param controller    Remote cluster controller
     * @param shutdownHook  Shutdown hook to register the undeployment
     *
     * @return  Future which completes when the controller runs
     */
    static Future<String> deployRemoteClusterOperator(Vertx vertx, RemoteClusterController controller, ShutdownHook shutdownHook) {
        return vertx.deployVerticle(new RemoteClusterOperator(controller, SHUTDOWN_TIMEOUT))
                .onSuccess(deploymentId -> {
                    shutdownHook.register(() -> ShutdownHook.undeployVertxVerticle(vertx, deploymentId, SHUTDOWN_TIMEOUT * 2));
                    LOGGER.info("Remote Cluster Operator verticle started");
                })
                .onFailure(error -> LOGGER.error("Remote Cluster Operator verticle failed to start", error));
    }

    /**
     * Utility method which waits until this instance of the operator is elected as a leader:
     *   - When it is not a leader, it will just wait
     *   - Once it is elected a leader, it will continue and start the controller
     *   - If it is removed as a leader, it exits so that the container starts from the beginning
     *
     * When the leader election is disabled, it just completes the future without waiting for anything.
     *
     * @param client        Kubernetes client
     * @param config        Operator configuration
     * @param shutdownHook  Shutdown hook to register leader election shutdown
     */
    private static Future<Void> leaderElection(KubernetesClient client, RemoteClusterOperatorConfig config, ShutdownHook shutdownHook)    {
        Promise<Void> leader = Promise.promise();
        Context context = Vertx.currentContext();

        if (config.getLeaderElectionConfig() != null) {
            LeaderElectionManager leaderElection = new LeaderElectionManager(
                    client, config.getLeaderElectionConfig(),
                    () -> {
                        LOGGER.info("I'm the new leader");
                        context.runOnContext(v -> leader.complete());
                    },
                    isShuttingDown -> {
                        if (!isShuttingDown) {
                            LOGGER.warn("Stopped being a leader => exiting");
                            // The exit call blocks, so it must not run on the leader election thread
                            CompletableFuture.runAsync(() -> System.exit(1));
                        } else {
                            LOGGER.info("Stopped being a leader during a shutdown");
                        }
                    },
                    newLeader -> LOGGER.info("Current leader is {}", newLeader));

            LOGGER.info("Waiting to become a leader");
            leaderElection.start();
            shutdownHook.register(leaderElection::stop);
        } else {
            LOGGER.info("Leader election is not enabled");
            leader.complete();
        }

        return leader.future();
    }

    /**
     * Start an HTTP health and metrics server
     *
     * @param vertx             Vertx instance
     * @param metricsProvider   Metrics Provider to get the metrics from
     * @param controller        Controller whose state is reported by the readiness endpoint
     *
     * @return Future which completes when the health and metrics webserver is started
     */
    private static Future<HttpServer> startHealthServer(Vertx vertx, MetricsProvider metricsProvider, RemoteClusterController controller) {
        return vertx.createHttpServer()
                .requestHandler(request -> {
                    if (request.path().equals("/healthy")) {
                        request.response().setStatusCode(204).end();
                    } else if (request.path().equals("/ready")) {
                        request.response().setStatusCode(controller.isStarted() ? 204 : 503).end();
                    } else if (request.path().equals("/metrics")) {
                        PrometheusMeterRegistry metrics = (PrometheusMeterRegistry) metricsProvider.meterRegistry();
                        request.response()
                                .putHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                                .setStatusCode(200)
                                .end(metrics.scrape());
                    } else {
                        request.response().setStatusCode(404).end();
                    }
                })
                .listen(HEALTH_SERVER_PORT)
                .onComplete(ar -> {
                    if (ar.succeeded()) {
                        LOGGER.info("Health and metrics server is ready on port {}", HEALTH_SERVER_PORT);
                    } else {
                        LOGGER.error("Failed to start health and metrics webserver on port {}", HEALTH_SERVER_PORT, ar.cause());
                    }
                });
    }
}
