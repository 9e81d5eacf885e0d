package utils;

import com.alibaba.fastjson2.JSON;
import module.ExplorationResult;
import report.AnalysisMessage;

import java.io.*;
import java.util.ArrayList;
import java.util.List;


/** Appends one JSON line per analyzed property to the result file. */
public class ResultExporter implements Closeable {
    public static final int CODE_SUCCESS = 0;
    public static final int CODE_TIMEOUT = 1;
    public static final int CODE_ERROR = 2;

    private final File outputFile;
    private final BufferedWriter bufferedWriter;
    private boolean closed = false;

    public ResultExporter(String outputPath) {
        this.outputFile = initOutputFile(outputPath);
        this.bufferedWriter = initBufferedWriter(this.outputFile);
    }

    private File initOutputFile(String outputPath) {
        File file = new File(outputPath);
        File parentDir = file.getParentFile();

        if (parentDir != null && !parentDir.exists()) {
            if (!parentDir.mkdirs()) {
                Log.error("Failed to create directory: " + parentDir.getAbsolutePath());
                throw new RuntimeException("Directory creation failed");
            }
        }
        return file;
    }

    private BufferedWriter initBufferedWriter(File file) {
        try {
            return new BufferedWriter(new FileWriter(file, true));
        } catch (IOException e) {
            Log.error("Failed to initialize BufferedWriter for file: " + file.getAbsolutePath() + e);
            throw new RuntimeException("BufferedWriter initialization failed", e);
        }
    }

    public File getOutputFile() {
        return outputFile;
    }

    /**
     * @param exploration null for TIMEOUT and ERROR codes
     */
    public synchronized void writeResult(int code, String property, ExplorationResult exploration, long time,
                                         String msg) {
        if (closed) {
            Log.warn("Result exporter already closed, dropping result for " + property);
            return;
        }
        try {
            bufferedWriter.write(toJson(code, property, exploration, time, msg));
            bufferedWriter.newLine();
            bufferedWriter.flush();
        } catch (IOException e) {
            Log.error("Failed to write result to file: " + this.outputFile.getAbsolutePath() + e);
        }
    }

    public static String toJson(int code, String property, ExplorationResult exploration, long time, String msg) {
        return JSON.toJSONString(new ResultOutput(code, property, exploration, time, msg));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            bufferedWriter.close();
        } catch (IOException e) {
            Log.error("Failed to close BufferedWriter: " + e.getMessage());
        }
    }

    public static class ResultOutput {
        private final int code;
        private final String property;
        private final String status;
        private final boolean exhausted;
        private final int iterations;
        private final List<String> messages = new ArrayList<>();
        private final long time;
        private final String msg;

        public ResultOutput(int code, String property, ExplorationResult exploration, long time, String msg) {
            this.code = code;
            this.property = property;
            this.time = time;
            this.msg = msg;
            if (exploration == null) {
                this.status = null;
                this.exhausted = false;
                this.iterations = 0;
            } else {
                this.status = exploration.getStatus() == null ? null : exploration.getStatus().name();
                this.exhausted = exploration.isExhausted();
                this.iterations = exploration.getIterations();
                for (AnalysisMessage message : exploration.getMessages()) {
                    messages.add(message.getState().getKey() + ": " + message.getMessage()
                            + " (" + message.getFilename() + ":" + message.getLine() + ")");
                }
            }
        }

        public int getCode() {
            return code;
        }

        public String getProperty() {
            return property;
        }

        public String getStatus() {
            return status;
        }

        public boolean isExhausted() {
            return exhausted;
        }

        public int getIterations() {
            return iterations;
        }

        public List<String> getMessages() {
            return messages;
        }

        public long getTime() {
            return time;
        }

        public String getMsg() {
            return msg;
        }
    }
}
