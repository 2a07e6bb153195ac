package com.phillippitts.scantomack.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the Python bridge engines.
 *
 * <p>Example application.properties:
 * <pre>
 * ocr.bridge.python=python3
 * ocr.bridge.probe-timeout-ms=5000
 * ocr.bridge.max-stdout-bytes=16777216
 * ocr.bridge.easyocr.enabled=true
 * ocr.bridge.paddleocr.script=/opt/ocr/paddleocr_bridge.py
 * </pre>
 *
 * <p>A blank {@code script} means the bundled classpath script is used.
 */
@ConfigurationProperties(prefix = "ocr.bridge")
public class BridgeProperties {

    private String python = "python3";
    private long probeTimeoutMs = 5000;
    private int maxStdoutBytes = 16 * 1024 * 1024;
    private EngineSettings easyocr = new EngineSettings();
    private EngineSettings paddleocr = new EngineSettings();

    public String getPython() {
        return python;
    }

    public void setPython(String python) {
        this.python = python;
    }

    public long getProbeTimeoutMs() {
        return probeTimeoutMs;
    }

    public void setProbeTimeoutMs(long probeTimeoutMs) {
        this.probeTimeoutMs = probeTimeoutMs;
    }

    public int getMaxStdoutBytes() {
        return maxStdoutBytes;
    }

    public void setMaxStdoutBytes(int maxStdoutBytes) {
        this.maxStdoutBytes = maxStdoutBytes;
    }

    public EngineSettings getEasyocr() {
        return easyocr;
    }

    public void setEasyocr(EngineSettings easyocr) {
        this.easyocr = easyocr;
    }

    public EngineSettings getPaddleocr() {
        return paddleocr;
    }

    public void setPaddleocr(EngineSettings paddleocr) {
        this.paddleocr = paddleocr;
    }

    /**
     * Per-engine bridge settings.
     */
    public static class EngineSettings {
        private boolean enabled = false;
        private String script;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getScript() {
            return script;
        }

        public void setScript(String script) {
            this.script = script;
        }
    }
}
