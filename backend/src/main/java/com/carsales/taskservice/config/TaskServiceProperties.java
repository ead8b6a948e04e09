package com.carsales.taskservice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "task-service")
public class TaskServiceProperties {
    private Queue queue = new Queue();
    private Worker worker = new Worker();
    private Data data = new Data();
    private Api api = new Api();
    private Recovery recovery = new Recovery();

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public void setRecovery(Recovery recovery) {
        this.recovery = recovery;
    }

    public static class Queue {
        private int capacity = 100;

        public int getCapacity() {
            return Math.max(1, capacity);
        }

        public void setCapacity(int capacity) {
            this.capacity = Math.max(1, capacity);
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int pollTimeoutMs = 1000;
        private int batchSize = 1000;
        private int taskTimeoutSeconds = 300;
        private int cancelGraceSeconds = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPollTimeoutMs() {
            return Math.max(100, pollTimeoutMs);
        }

        public void setPollTimeoutMs(int pollTimeoutMs) {
            this.pollTimeoutMs = Math.max(100, pollTimeoutMs);
        }

        public int getBatchSize() {
            return Math.max(1, batchSize);
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
        }

        public int getTaskTimeoutSeconds() {
            return Math.max(1, taskTimeoutSeconds);
        }

        public void setTaskTimeoutSeconds(int taskTimeoutSeconds) {
            this.taskTimeoutSeconds = Math.max(1, taskTimeoutSeconds);
        }

        public int getCancelGraceSeconds() {
            return Math.max(1, cancelGraceSeconds);
        }

        public void setCancelGraceSeconds(int cancelGraceSeconds) {
            this.cancelGraceSeconds = Math.max(1, cancelGraceSeconds);
        }
    }

    public static class Data {
        private String unifiedCsv = "../data/unified_cars.csv";

        public String getUnifiedCsv() {
            return unifiedCsv;
        }

        public void setUnifiedCsv(String unifiedCsv) {
            this.unifiedCsv = unifiedCsv;
        }
    }

    public static class Api {
        private List<String> corsOrigins = new ArrayList<>(List.of("http://localhost:3000"));

        public List<String> getCorsOrigins() {
            return corsOrigins;
        }

        public void setCorsOrigins(List<String> corsOrigins) {
            this.corsOrigins = corsOrigins == null ? new ArrayList<>() : corsOrigins;
        }
    }

    public static class Recovery {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
