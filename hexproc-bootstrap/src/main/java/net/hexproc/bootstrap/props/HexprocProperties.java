package net.hexproc.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("hexproc")
public class HexprocProperties {
    private Scheduler scheduler = new Scheduler();
    private Throughput throughput = new Throughput();
    private Servers servers = new Servers();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Throughput getThroughput() {
        return throughput;
    }

    public void setThroughput(Throughput throughput) {
        this.throughput = throughput;
    }

    public Servers getServers() {
        return servers;
    }

    public void setServers(Servers servers) {
        this.servers = servers;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long tickDelayMs = 1000;
        private long maintenanceDelayMs = 10000;
        private int maxTicksPerPass = 100;
        private int maintenanceBatch = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }

        public int getMaxTicksPerPass() {
            return maxTicksPerPass;
        }

        public void setMaxTicksPerPass(int maxTicksPerPass) {
            this.maxTicksPerPass = maxTicksPerPass;
        }

        public int getMaintenanceBatch() {
            return maintenanceBatch;
        }

        public void setMaintenanceBatch(int maintenanceBatch) {
            this.maintenanceBatch = maintenanceBatch;
        }
    }

    /** 선형 처리량 정책 계수: base + cpu*cpuWeight + net*netWeight (작업량/초) */
    public static class Throughput {
        private double baseRate = 1.0;
        private double cpuWeight = 0.01;
        private double netWeight = 0.01;

        public double getBaseRate() {
            return baseRate;
        }

        public void setBaseRate(double baseRate) {
            this.baseRate = baseRate;
        }

        public double getCpuWeight() {
            return cpuWeight;
        }

        public void setCpuWeight(double cpuWeight) {
            this.cpuWeight = cpuWeight;
        }

        public double getNetWeight() {
            return netWeight;
        }

        public void setNetWeight(double netWeight) {
            this.netWeight = netWeight;
        }
    }

    public static class Servers {
        private boolean enabled = true;
        private List<PoolDef> pools = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<PoolDef> getPools() {
            return pools;
        }

        public void setPools(List<PoolDef> pools) {
            this.pools = pools;
        }
    }

    public static class PoolDef {
        private Long id;
        private long cpu;
        private long ram;
        private long hdd;
        private long net;
        private int difficulty = 50;

        public Long getId() {
            return id;
        }

        public void setId(Long id) {
            this.id = id;
        }

        public long getCpu() {
            return cpu;
        }

        public void setCpu(long cpu) {
            this.cpu = cpu;
        }

        public long getRam() {
            return ram;
        }

        public void setRam(long ram) {
            this.ram = ram;
        }

        public long getHdd() {
            return hdd;
        }

        public void setHdd(long hdd) {
            this.hdd = hdd;
        }

        public long getNet() {
            return net;
        }

        public void setNet(long net) {
            this.net = net;
        }

        public int getDifficulty() {
            return difficulty;
        }

        public void setDifficulty(int difficulty) {
            this.difficulty = difficulty;
        }

        @Override
        public String toString() {
            return "PoolDef{" +
                    "id=" + id +
                    ", cpu=" + cpu +
                    ", ram=" + ram +
                    ", hdd=" + hdd +
                    ", net=" + net +
                    ", difficulty=" + difficulty +
                    '}';
        }
    }
}
