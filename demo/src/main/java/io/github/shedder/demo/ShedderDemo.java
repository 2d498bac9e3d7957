package io.github.shedder.demo;

import io.github.shedder.LoadShedder;
import io.github.shedder.aggregator.ConcurrencyCounter;
import io.github.shedder.config.ConfigLoader;
import io.github.shedder.config.ShedderConfig;
import io.github.shedder.engine.EngineSnapshot;
import io.github.shedder.servlet.LoadSheddingFilter;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.catalina.Context;
import org.apache.catalina.startup.Tomcat;
import org.apache.tomcat.util.descriptor.web.FilterDef;
import org.apache.tomcat.util.descriptor.web.FilterMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Overload demo: an embedded Tomcat endpoint behind {@link LoadSheddingFilter}, hit by background
 * traffic plus a burst every 20 seconds.
 *
 * <p>Without shedding the burst drives in-flight requests past the backend's comfort zone and
 * latency climbs for everyone. With shedding the filter turns away a growing share of requests
 * with 503s, keeping latency of the accepted ones bounded. Configuration is read from
 * {@code shedder-demo.json} on the classpath.</p>
 */
public class ShedderDemo {

    private static final Logger log = LoggerFactory.getLogger(ShedderDemo.class);

    private static final int PORT = 8085;
    private static final Duration RUN_TIME = Duration.ofMinutes(2);

    private static final AtomicInteger accepted = new AtomicInteger();
    private static final AtomicInteger rejected = new AtomicInteger();
    private static final AtomicInteger failed = new AtomicInteger();

    public static void main(String[] args) throws Exception {
        ShedderConfig config = ConfigLoader.fromResource("shedder-demo.json");
        ConcurrencyCounter inFlight = new ConcurrencyCounter();
        LoadShedder shedder = LoadShedder.builder()
            .config(config)
            .concurrencyCounter(inFlight)
            .build();
        LatencySimulator simulator = new LatencySimulator(inFlight);

        Tomcat tomcat = startServer(shedder, simulator);

        HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
        ExecutorService requestExecutor = Executors.newFixedThreadPool(200);
        ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(3);
        URI target = URI.create("http://localhost:" + PORT + "/work");

        // Background load: ~100 RPS
        scheduler.scheduleAtFixedRate(() -> {
            for (int i = 0; i < 10; i++) {
                requestExecutor.submit(() -> send(client, target));
            }
        }, 0, 100, TimeUnit.MILLISECONDS);

        // Burst: 2,000 requests every 20 seconds
        scheduler.scheduleAtFixedRate(() -> {
            log.info("Burst: sending 2000 requests");
            for (int i = 0; i < 2000; i++) {
                requestExecutor.submit(() -> send(client, target));
            }
        }, 10, 20, TimeUnit.SECONDS);

        scheduler.scheduleAtFixedRate(() -> report(shedder, inFlight), 1, 1, TimeUnit.SECONDS);

        Thread.sleep(RUN_TIME.toMillis());

        scheduler.shutdownNow();
        requestExecutor.shutdownNow();
        boolean drained = inFlight.awaitIdle(Duration.ofSeconds(10));
        log.info("Drained in-flight requests: {}", drained);
        tomcat.stop();
        tomcat.destroy();
        log.info("Totals: accepted={}, rejected={}, failed={}", accepted.get(), rejected.get(), failed.get());
    }

    private static Tomcat startServer(LoadShedder shedder, LatencySimulator simulator) throws Exception {
        Tomcat tomcat = new Tomcat();
        tomcat.setPort(PORT);
        tomcat.getConnector(); // trigger connector creation

        Context ctx = tomcat.addContext("", null);

        Tomcat.addServlet(ctx, "work", new WorkServlet(simulator));
        ctx.addServletMappingDecoded("/work", "work");

        FilterDef filterDef = new FilterDef();
        filterDef.setFilterName("loadShedding");
        filterDef.setFilter(new LoadSheddingFilter(shedder));
        ctx.addFilterDef(filterDef);

        FilterMap filterMap = new FilterMap();
        filterMap.setFilterName("loadShedding");
        filterMap.addURLPatternDecoded("/*");
        ctx.addFilterMap(filterMap);

        tomcat.start();
        log.info("Demo server started on port {}", PORT);
        return tomcat;
    }

    private static void send(HttpClient client, URI target) {
        try {
            HttpResponse<Void> response = client.send(
                HttpRequest.newBuilder(target).timeout(Duration.ofSeconds(30)).GET().build(),
                HttpResponse.BodyHandlers.discarding());
            if (response.statusCode() == HttpServletResponse.SC_SERVICE_UNAVAILABLE) {
                rejected.incrementAndGet();
            } else {
                accepted.incrementAndGet();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            failed.incrementAndGet();
            log.debug("Request failed", e);
        }
    }

    private static void report(LoadShedder shedder, ConcurrencyCounter inFlight) {
        EngineSnapshot snapshot = shedder.snapshot();
        log.info("status={} p={} inFlight={} accepted={} rejected={} contributions={}",
            snapshot.status(),
            String.format("%.2f", snapshot.probability()),
            inFlight.current(),
            accepted.get(),
            rejected.get(),
            snapshot.contributions());
    }

    private static class WorkServlet extends HttpServlet {
        private final LatencySimulator simulator;

        WorkServlet(LatencySimulator simulator) {
            this.simulator = simulator;
        }

        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            try {
                long latency = simulator.simulate();
                resp.setContentType("application/json");
                resp.getWriter().write("{\"latencyMs\":" + latency + "}");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                resp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
            }
        }
    }
}
