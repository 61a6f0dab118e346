package com.testflow.testflow_runner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything under {@code testflow.*} in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "testflow")
public class TestflowProperties {

    private Parser parser = new Parser();
    private Engine engine = new Engine();
    private Control control = new Control();
    private Result result = new Result();
    private Transport transport = new Transport();
    private Launch launch = new Launch();
    private Runs runs = new Runs();

    @Data
    public static class Parser {
        /** Match structural markers (#NODE, Loop_start...) case sensitively. */
        private boolean caseSensitive = true;
        /** Fail the parse when a jump reference cannot be resolved. */
        private boolean strictReferences = false;
    }

    @Data
    public static class Engine {
        private long maxInstructions = 1_000_000;
        private int maxWorkflowDepth = 8;
        /** Settling delay after every instrument query. */
        private Duration querySettle = Duration.ofMillis(80);
    }

    @Data
    public static class Control {
        private Duration pauseTick = Duration.ofSeconds(1);
        private String statusFile = "status.txt";
    }

    @Data
    public static class Result {
        private int writeRetries = 100;
        private Duration writeBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class Transport {
        /** Abort the run when an INST:: address is not reachable. */
        private boolean requireReachable = false;
        private Simulated simulated = new Simulated();

        @Data
        public static class Simulated {
            private String identity = "TESTFLOW,SIMULATED-INSTRUMENT,0,1.0";
            private String defaultReply = "0";
            /** Canned replies keyed by command text. */
            private Map<String, String> replies = new LinkedHashMap<>();
        }
    }

    @Data
    public static class Launch {
        private String script;
        private String output;
        private boolean debug;
    }

    @Data
    public static class Runs {
        /** Finished runs kept for the REST surface; older ones are dropped first. */
        private int retainFinished = 100;
    }
}
