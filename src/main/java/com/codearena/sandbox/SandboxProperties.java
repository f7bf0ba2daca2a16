package com.codearena.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@ConfigurationProperties(prefix = "codearena")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();
    private Executor executor = new Executor();

    // -- Sandbox accessors (delegate to nested) --
    public long getTimeoutMs() { return sandbox.timeoutMs; }
    public long getCompiledTimeoutMs() { return sandbox.compiledTimeoutMs; }
    public String getMemory() { return sandbox.memory; }
    public long getCpuQuota() { return sandbox.cpuQuota; }
    public String getTempDir() { return sandbox.tempDir; }
    public int getStopGraceSeconds() { return sandbox.stopGraceSeconds; }
    public String getScriptImage() { return sandbox.images.script; }
    public String getServerSideImage() { return sandbox.images.serverSide; }
    public String getCompiledImage() { return sandbox.images.compiled; }

    /**
     * Memory ceiling in bytes, parsed from strings such as {@code "128m"},
     * {@code "1g"}, {@code "512k"} or a plain byte count.
     */
    public long getMemoryBytes() {
        return parseMemory(sandbox.memory);
    }

    // -- Executor accessors (delegate to nested) --
    public boolean isUseNativeGo() { return executor.useNativeGo; }
    public long getNativeGoTimeoutMs() { return executor.nativeGoTimeoutMs; }
    public String getGoBinary() { return executor.goBinary; }
    public long getProbeTimeoutMs() { return executor.probeTimeoutMs; }
    public long getModuleInitTimeoutMs() { return executor.moduleInitTimeoutMs; }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }

    static long parseMemory(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Memory limit must not be blank");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1;
        char unit = v.charAt(v.length() - 1);
        if (unit == 'k' || unit == 'm' || unit == 'g') {
            multiplier = switch (unit) {
                case 'k' -> 1024L;
                case 'm' -> 1024L * 1024;
                default -> 1024L * 1024 * 1024;
            };
            v = v.substring(0, v.length() - 1);
        }
        try {
            return Long.parseLong(v.trim()) * multiplier;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid memory limit: " + value, e);
        }
    }

    public static class Sandbox {
        private long timeoutMs = 10_000;
        private long compiledTimeoutMs = 35_000;
        private String memory = "128m";
        private long cpuQuota = 100_000;
        private String tempDir = "temp";
        private int stopGraceSeconds = 1;
        private Images images = new Images();

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
        public long getCompiledTimeoutMs() { return compiledTimeoutMs; }
        public void setCompiledTimeoutMs(long compiledTimeoutMs) { this.compiledTimeoutMs = compiledTimeoutMs; }
        public String getMemory() { return memory; }
        public void setMemory(String memory) { this.memory = memory; }
        public long getCpuQuota() { return cpuQuota; }
        public void setCpuQuota(long cpuQuota) { this.cpuQuota = cpuQuota; }
        public String getTempDir() { return tempDir; }
        public void setTempDir(String tempDir) { this.tempDir = tempDir; }
        public int getStopGraceSeconds() { return stopGraceSeconds; }
        public void setStopGraceSeconds(int stopGraceSeconds) { this.stopGraceSeconds = stopGraceSeconds; }
        public Images getImages() { return images; }
        public void setImages(Images images) { this.images = images; }
    }

    public static class Images {
        private String script = "code-runner";
        private String serverSide = "php-runner";
        private String compiled = "go-runner";

        public String getScript() { return script; }
        public void setScript(String script) { this.script = script; }
        public String getServerSide() { return serverSide; }
        public void setServerSide(String serverSide) { this.serverSide = serverSide; }
        public String getCompiled() { return compiled; }
        public void setCompiled(String compiled) { this.compiled = compiled; }
    }

    public static class Executor {
        private boolean useNativeGo = false;
        private long nativeGoTimeoutMs = 45_000;
        private String goBinary = "go";
        private long probeTimeoutMs = 5_000;
        private long moduleInitTimeoutMs = 10_000;

        public boolean isUseNativeGo() { return useNativeGo; }
        public void setUseNativeGo(boolean useNativeGo) { this.useNativeGo = useNativeGo; }
        public long getNativeGoTimeoutMs() { return nativeGoTimeoutMs; }
        public void setNativeGoTimeoutMs(long nativeGoTimeoutMs) { this.nativeGoTimeoutMs = nativeGoTimeoutMs; }
        public String getGoBinary() { return goBinary; }
        public void setGoBinary(String goBinary) { this.goBinary = goBinary; }
        public long getProbeTimeoutMs() { return probeTimeoutMs; }
        public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }
        public long getModuleInitTimeoutMs() { return moduleInitTimeoutMs; }
        public void setModuleInitTimeoutMs(long moduleInitTimeoutMs) { this.moduleInitTimeoutMs = moduleInitTimeoutMs; }
    }
}
