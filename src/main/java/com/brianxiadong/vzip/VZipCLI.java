package com.brianxiadong.vzip;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * 视频帧压缩命令行工具
 * 将目录中的帧文件按文件名顺序压缩为一个 .vzip 归档
 */
public class VZipCLI {

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * @return 进程退出码，0 表示成功
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        long start = System.nanoTime();
        if (args.length == 0 || "help".equals(args[0]) || "--help".equals(args[0])) {
            printUsage(out);
            return args.length == 0 ? 1 : 0;
        }

        VZipConfig config;
        Path framesDir;
        try {
            VZipConfig.Builder builder = VZipConfig.builderFromSystemProperties();
            framesDir = Paths.get(args[0]);
            parseOptions(args, builder);
            config = builder.build().validate();
        } catch (IllegalArgumentException e) {
            err.println("错误: " + e.getMessage());
            printUsage(err);
            return 1;
        }

        try {
            MetricsHttpServer.startIfEnabled();
            FrameSource source = new DirectoryFrameSource(framesDir, config.getFrameSuffix());
            VZipCompressor compressor = new VZipCompressor(config);
            CompressionSummary summary = compressor.compress(source, Paths.get(config.getOutput()));

            // 计时覆盖目录扫描与归档落盘
            double seconds = (System.nanoTime() - start) / 1e9;
            out.printf(Locale.ROOT, "Compression rate: %.2f%%%n", summary.getCompressionRate() * 100);
            out.printf(Locale.ROOT, "Time: %.2f seconds%n", seconds);
            return 0;
        } catch (VZipException e) {
            err.println("错误 [" + e.getKind() + "]: " + describe(e));
            return 1;
        } catch (Exception e) {
            err.println("执行压缩时发生错误: " + describe(e));
            return 1;
        }
    }

    private static void parseOptions(String[] args, VZipConfig.Builder builder) {
        for (int i = 1; i < args.length; i++) {
            String opt = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("缺少参数值: " + opt);
            }
            String value = args[++i];
            switch (opt) {
                case "--output":
                case "-o":
                    builder.output(value);
                    break;
                case "--workers":
                case "-w":
                    builder.workers(parseInt(opt, value));
                    break;
                case "--buffer-size":
                    builder.bufferSize(parseInt(opt, value));
                    break;
                case "--codec":
                    builder.codec(value);
                    break;
                case "--partition":
                    builder.partition(value);
                    break;
                case "--suffix":
                    builder.frameSuffix(value);
                    break;
                default:
                    throw new IllegalArgumentException("未知选项: " + opt);
            }
        }
    }

    private static int parseInt(String opt, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(opt + " 需要整数: " + value, e);
        }
    }

    private static String describe(Throwable e) {
        StringBuilder sb = new StringBuilder(String.valueOf(e.getMessage()));
        Throwable c = e.getCause();
        while (c != null) {
            sb.append(" <- ").append(c.getMessage());
            c = c.getCause();
        }
        return sb.toString();
    }

    private static void printUsage(PrintStream out) {
        out.println("VZip - 视频帧并行压缩工具");
        out.println();
        out.println("用法: java VZipCLI <frames_dir> [options]");
        out.println();
        out.println("选项:");
        out.println("  --output, -o <file>      输出归档路径 (默认 " + VZipConfig.DEFAULT_OUTPUT + ")");
        out.println("  --workers, -w <n>        worker 数量 (默认 " + VZipConfig.DEFAULT_WORKERS + ")");
        out.println("  --buffer-size <bytes>    单帧缓冲区大小，超出部分截断 (默认 " + VZipConfig.DEFAULT_BUFFER_SIZE + ")");
        out.println("  --codec <name>           DEFLATE | LZ4 | NONE (默认 " + VZipConfig.DEFAULT_CODEC + ")");
        out.println("  --partition <name>       striped | contiguous (默认 " + VZipConfig.DEFAULT_PARTITION + ")");
        out.println("  --suffix <ext>           帧文件后缀 (默认 " + VZipConfig.DEFAULT_FRAME_SUFFIX + ")");
        out.println();
        out.println("同名系统属性 (-Dvzip.workers=8 等) 提供默认值，命令行选项优先");
        out.println();
        out.println("示例:");
        out.println("  java VZipCLI frames/ --workers 8 --output video.vzip");
    }
}
