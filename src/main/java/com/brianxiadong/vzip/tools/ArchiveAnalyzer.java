package com.brianxiadong.vzip.tools;

import com.brianxiadong.vzip.ArchiveFormat;
import com.brianxiadong.vzip.ArchiveReader;
import com.brianxiadong.vzip.CodecException;
import com.brianxiadong.vzip.CompressedFrame;
import com.brianxiadong.vzip.CompressionStrategy;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * VZip 归档分析工具
 * 提供归档的解析、统计、校验、解压导出功能
 */
public class ArchiveAnalyzer {

    /**
     * 归档分析结果
     */
    public static class AnalysisResult {
        private final String filePath;
        private final long fileSize;
        private final List<Integer> frameSizes;
        private final boolean isValid;
        private final String errorMessage;

        public AnalysisResult(String filePath, long fileSize, List<Integer> frameSizes,
                boolean isValid, String errorMessage) {
            this.filePath = filePath;
            this.fileSize = fileSize;
            this.frameSizes = Collections.unmodifiableList(frameSizes);
            this.isValid = isValid;
            this.errorMessage = errorMessage;
        }

        public String getFilePath() { return filePath; }
        public long getFileSize() { return fileSize; }
        public List<Integer> getFrameSizes() { return frameSizes; }
        public int getFrameCount() { return frameSizes.size(); }
        public boolean isValid() { return isValid; }
        public String getErrorMessage() { return errorMessage; }

        public long getTotalPayload() {
            long t = 0;
            for (int s : frameSizes)
                t += s;
            return t;
        }

        public int getMinFrameSize() {
            return frameSizes.isEmpty() ? 0 : Collections.min(frameSizes);
        }

        public int getMaxFrameSize() {
            return frameSizes.isEmpty() ? 0 : Collections.max(frameSizes);
        }

        public double getAverageFrameSize() {
            return frameSizes.isEmpty() ? 0.0 : (double) getTotalPayload() / frameSizes.size();
        }
    }

    /**
     * 解析归档结构；格式错误记录在结果中而不是抛出
     */
    public static AnalysisResult analyzeArchive(String filePath) throws IOException {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            throw new FileNotFoundException("归档文件不存在: " + filePath);
        }
        long fileSize = Files.size(path);
        List<Integer> sizes = new ArrayList<>();
        try (ArchiveReader reader = openReader(path)) {
            CompressedFrame frame;
            while ((frame = reader.next()) != null) {
                sizes.add(frame.getLength());
            }
        } catch (IOException e) {
            return new AnalysisResult(filePath, fileSize, sizes, false, e.getMessage());
        }
        return new AnalysisResult(filePath, fileSize, sizes, true, null);
    }

    /**
     * 结构完整且每一帧都能用给定编解码器解压时返回 true
     */
    public static boolean validateArchive(String filePath, CompressionStrategy codec, int maxFrameSize) {
        try {
            AnalysisResult result = analyzeArchive(filePath);
            if (!result.isValid()) {
                return false;
            }
            byte[] buffer = new byte[maxFrameSize];
            try (ArchiveReader reader = openReader(Paths.get(filePath))) {
                CompressedFrame frame;
                while ((frame = reader.next()) != null) {
                    codec.decompress(frame.getData(), frame.getLength(), buffer);
                }
            }
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * 解压所有帧到目录，文件名为 frame_00000.ppm 这样的顺序编号
     * @return 解压的帧数
     */
    public static int extractFrames(String filePath, String outputDir, CompressionStrategy codec,
            int maxFrameSize, String suffix) throws IOException {
        Path dir = Paths.get(outputDir);
        Files.createDirectories(dir);
        byte[] buffer = new byte[maxFrameSize];
        int count = 0;
        try (ArchiveReader reader = openReader(Paths.get(filePath))) {
            CompressedFrame frame;
            while ((frame = reader.next()) != null) {
                int len;
                try {
                    len = codec.decompress(frame.getData(), frame.getLength(), buffer);
                } catch (CodecException e) {
                    throw new IOException("第 " + count + " 帧解压失败", e);
                }
                Path target = dir.resolve(String.format("frame_%05d%s", count, suffix));
                try (OutputStream out = Files.newOutputStream(target)) {
                    out.write(buffer, 0, len);
                }
                count++;
            }
        }
        return count;
    }

    /**
     * 单帧负载不可能超过文件本身的大小
     */
    private static ArchiveReader openReader(Path path) throws IOException {
        long limit = Math.max(0, Files.size(path) - ArchiveFormat.LENGTH_FIELD_SIZE);
        return new ArchiveReader(new BufferedInputStream(Files.newInputStream(path)), limit);
    }

    /**
     * 格式化分析结果
     */
    public static String formatAnalysisResult(AnalysisResult result, boolean showFrames) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== VZip 归档分析报告 ===\n");
        sb.append("文件路径: ").append(result.getFilePath()).append("\n");
        sb.append("文件大小: ").append(formatFileSize(result.getFileSize())).append("\n");
        sb.append("文件状态: ").append(result.isValid() ? "有效" : "无效").append("\n");
        if (!result.isValid()) {
            sb.append("错误信息: ").append(result.getErrorMessage()).append("\n");
        }
        sb.append("\n=== 帧统计 ===\n");
        sb.append("帧数量: ").append(result.getFrameCount()).append("\n");
        sb.append("压缩数据总量: ").append(formatFileSize(result.getTotalPayload())).append("\n");
        sb.append("最小帧: ").append(result.getMinFrameSize()).append(" bytes\n");
        sb.append("最大帧: ").append(result.getMaxFrameSize()).append(" bytes\n");
        sb.append(String.format("平均帧: %.1f bytes%n", result.getAverageFrameSize()));

        if (showFrames && result.getFrameCount() > 0) {
            sb.append("\n=== 帧列表 ===\n");
            sb.append(String.format("%-10s %-15s%n", "序号", "压缩大小"));
            long offset = 0;
            for (int i = 0; i < result.getFrameCount(); i++) {
                int size = result.getFrameSizes().get(i);
                sb.append(String.format("%-10d %-15d offset=%d%n", i, size, offset));
                offset += ArchiveFormat.LENGTH_FIELD_SIZE + size;
            }
        }
        return sb.toString();
    }

    /**
     * 导出统计信息为JSON格式
     */
    public static void exportToJSON(AnalysisResult result, String outputPath) throws IOException {
        try (PrintWriter writer = new PrintWriter(new FileWriter(outputPath))) {
            writer.println("{");
            writer.println("  \"path\": \"" + escapeJson(result.getFilePath()) + "\",");
            writer.println("  \"size\": " + result.getFileSize() + ",");
            writer.println("  \"valid\": " + result.isValid() + ",");
            writer.println("  \"frame_count\": " + result.getFrameCount() + ",");
            writer.println("  \"total_payload\": " + result.getTotalPayload() + ",");
            writer.print("  \"frame_sizes\": [");
            List<Integer> sizes = result.getFrameSizes();
            for (int i = 0; i < sizes.size(); i++) {
                if (i > 0)
                    writer.print(", ");
                writer.print(sizes.get(i));
            }
            writer.println("]");
            writer.println("}");
        }
    }

    private static String formatFileSize(long bytes) {
        if (bytes < 1024) return bytes + " B";
        if (bytes < 1024 * 1024) return String.format("%.1f KB", bytes / 1024.0);
        if (bytes < 1024 * 1024 * 1024) return String.format("%.1f MB", bytes / (1024.0 * 1024));
        return String.format("%.1f GB", bytes / (1024.0 * 1024 * 1024));
    }

    private static String escapeJson(String str) {
        return str.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
