package com.boxoffice;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.boxoffice.engine.ConfigurationException;
import com.boxoffice.engine.InventoryEngine;
import com.boxoffice.engine.Limits;
import com.boxoffice.service.JsonCodec;
import com.boxoffice.service.TicketService;
import com.boxoffice.theatre.Theatre;
import com.sun.net.httpserver.HttpServer;

/**
 * <p>
 * Implements the <em>main</em> method and the command line interface.
 * </p>
 *
 * <p>
 * By default the ticketing service is started as an HTTP server. With
 * {@code -simulate} a theatre is simulated in-process instead and its
 * summary report is printed to standard output.
 * </p>
 */
public class Cli {
    private static final Logger LOG = LoggerFactory.getLogger(Cli.class);

    /**
     * Explicit default constructor.
     */
    protected Cli() {
    }

    /**
     * Port for the HTTP server to listen on.
     */
    @Parameter(names = "-port")
    private int port = 8080;

    /**
     * Hostname for the HTTP server to listen on.
     */
    @Parameter(names = "-host")
    private String host = "127.0.0.1";

    /**
     * Number of threads serving HTTP requests.
     */
    @Parameter(names = "-server-threads")
    private int serverThreads = 64;

    /**
     * Simulate a theatre instead of serving requests.
     */
    @Parameter(names = "-simulate")
    private boolean simulate = false;

    @Parameter(names = "-exchanges")
    private int exchanges = 200;

    @Parameter(names = "-movies")
    private int movies = 5;

    @Parameter(names = "-showings")
    private int showings = 4;

    @Parameter(names = "-seats")
    private int seats = 100;

    @Parameter(names = "-windows")
    private int windows = 2;

    /**
     * How long the simulated theatre sells tickets.
     */
    @Parameter(names = "-run-seconds")
    private int runSeconds = 10;

    /**
     * Maximum number of tickets a simulated customer buys.
     */
    @Parameter(names = "-max-per-sale")
    private int maxPerSale = 1;

    /**
     * Average delay between two simulated customers at a window.
     */
    @Parameter(names = "-avg-delay-millis")
    private int avgDelayMillis = 100;

    @Parameter(names = { "-help", "--help" }, help = true)
    private boolean help = false;

    /**
     * Main entry point.
     *
     * @param args Command line arguments.
     * @throws Exception When the service cannot be started or the simulation fails.
     */
    public static void main(final String[] args) throws Exception {
        final var app = new Cli();
        final var commander = JCommander.newBuilder().addObject(app).programName("box-office").build();
        commander.parse(args);
        if (app.help) {
            commander.usage();
            return;
        }
        if (app.simulate) {
            app.simulate();
        } else {
            app.serve();
        }
    }

    /**
     * Starts the HTTP server. The engine waits for an init request.
     *
     * @throws IOException When there is an I/O error.
     */
    public void serve() throws IOException {
        final var server = HttpServer.create(new InetSocketAddress(this.host, this.port), 8);
        final var engine = new InventoryEngine(error -> {
            LOG.error("Ticketing system cannot continue, terminating");
            server.stop(0);
            System.exit(1);
        });
        final var handler = new TicketService(engine, new JsonCodec(), returnCode -> {
            // Leave the request thread so that the stop response is delivered.
            final var stopper = new Thread(() -> {
                server.stop(1);
                System.exit(returnCode);
            }, "shutdown");
            stopper.start();
        });
        // We are doing all the routing of requests ourselves.
        server.createContext("/", new RouteHandler(handler));
        // Use a fixed thread pool as an executor for concurrent requests.
        server.setExecutor(Executors.newFixedThreadPool(this.serverThreads));
        server.start();
        LOG.info("Ticketing service listening on {}:{}", this.host, this.port);
    }

    /**
     * Runs the theatre simulation and prints its report.
     *
     * @throws ConfigurationException If the limits are invalid.
     * @throws InterruptedException   The thread has been interrupted.
     * @throws ExecutionException     If the simulation failed.
     */
    public void simulate() throws ConfigurationException, InterruptedException, ExecutionException {
        final var limits = new Limits(this.exchanges, this.movies, this.showings, this.seats, this.windows);
        final var config = new Config(limits, Duration.ofSeconds(this.runSeconds), this.maxPerSale,
                Duration.ofMillis(this.avgDelayMillis));
        final var engine = new InventoryEngine(error -> LOG.error("Ticketing system cannot continue"));
        final var report = new Theatre(config, engine).run();
        System.out.println(report.render());
    }
}
