package com.brianxiadong.vzip.tools;

import com.brianxiadong.vzip.CompressionStrategies;
import com.brianxiadong.vzip.CompressionStrategy;
import com.brianxiadong.vzip.VZipConfig;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;

/**
 * 归档分析器命令行界面
 * 提供归档分析、校验、解压、导出等功能
 */
public class ArchiveAnalyzerCLI {

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(out);
            return 1;
        }

        String command = args[0].toLowerCase();
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        try {
            switch (command) {
                case "analyze":
                    return handleAnalyze(rest, out, err);
                case "validate":
                    return handleValidate(rest, out, err);
                case "extract":
                    return handleExtract(rest, out, err);
                case "export":
                    return handleExport(rest, out, err);
                case "help":
                    printUsage(out);
                    return 0;
                default:
                    err.println("未知命令: " + command);
                    printUsage(err);
                    return 1;
            }
        } catch (Exception e) {
            err.println("执行命令时发生错误: " + e.getMessage());
            return 1;
        }
    }

    /**
     * 处理analyze命令
     */
    private static int handleAnalyze(String[] args, PrintStream out, PrintStream err) throws IOException {
        if (args.length == 0) {
            err.println("错误: 请指定归档文件路径");
            err.println("用法: analyze <archive> [--show-frames]");
            return 1;
        }
        String archive = args[0];
        boolean showFrames = false;
        for (int i = 1; i < args.length; i++) {
            if ("--show-frames".equals(args[i])) {
                showFrames = true;
            }
        }
        if (!checkExists(archive, err)) {
            return 1;
        }
        ArchiveAnalyzer.AnalysisResult result = ArchiveAnalyzer.analyzeArchive(archive);
        out.println(ArchiveAnalyzer.formatAnalysisResult(result, showFrames));
        return result.isValid() ? 0 : 1;
    }

    /**
     * 处理validate命令
     */
    private static int handleValidate(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println("错误: 请指定归档文件路径");
            err.println("用法: validate <archive> [--codec <name>] [--buffer-size <bytes>]");
            return 1;
        }
        String archive = args[0];
        if (!checkExists(archive, err)) {
            return 1;
        }
        Options opts = Options.parse(Arrays.copyOfRange(args, 1, args.length));
        if (ArchiveAnalyzer.validateArchive(archive, opts.codec, opts.bufferSize)) {
            out.println("✅ 归档验证通过: " + archive);
            return 0;
        }
        out.println("❌ 归档验证失败: " + archive);
        return 1;
    }

    /**
     * 处理extract命令
     */
    private static int handleExtract(String[] args, PrintStream out, PrintStream err) throws IOException {
        if (args.length < 2) {
            err.println("错误: 请指定归档文件路径和输出目录");
            err.println("用法: extract <archive> <output_dir> [--codec <name>] [--buffer-size <bytes>] [--suffix <ext>]");
            return 1;
        }
        String archive = args[0];
        if (!checkExists(archive, err)) {
            return 1;
        }
        Options opts = Options.parse(Arrays.copyOfRange(args, 2, args.length));
        int n = ArchiveAnalyzer.extractFrames(archive, args[1], opts.codec, opts.bufferSize, opts.suffix);
        out.println("✅ 已解压 " + n + " 帧到: " + args[1]);
        return 0;
    }

    /**
     * 处理export命令
     */
    private static int handleExport(String[] args, PrintStream out, PrintStream err) throws IOException {
        if (args.length < 2) {
            err.println("错误: 请指定归档文件路径和输出文件路径");
            err.println("用法: export <archive> <output_file>");
            return 1;
        }
        String archive = args[0];
        if (!checkExists(archive, err)) {
            return 1;
        }
        ArchiveAnalyzer.AnalysisResult result = ArchiveAnalyzer.analyzeArchive(archive);
        ArchiveAnalyzer.exportToJSON(result, args[1]);
        out.println("✅ 归档统计已导出到: " + args[1]);
        out.println("帧数量: " + result.getFrameCount());
        return 0;
    }

    private static boolean checkExists(String archive, PrintStream err) {
        if (!new File(archive).exists()) {
            err.println("错误: 归档文件不存在: " + archive);
            return false;
        }
        return true;
    }

    /**
     * 解压相关选项
     */
    private static class Options {
        CompressionStrategy codec = CompressionStrategies.forName(VZipConfig.DEFAULT_CODEC);
        int bufferSize = VZipConfig.DEFAULT_BUFFER_SIZE;
        String suffix = VZipConfig.DEFAULT_FRAME_SUFFIX;

        static Options parse(String[] args) {
            Options o = new Options();
            for (int i = 0; i < args.length; i += 2) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("缺少参数值: " + args[i]);
                }
                switch (args[i]) {
                    case "--codec":
                        o.codec = CompressionStrategies.forName(args[i + 1]);
                        break;
                    case "--buffer-size":
                        o.bufferSize = Integer.parseInt(args[i + 1]);
                        break;
                    case "--suffix":
                        o.suffix = args[i + 1];
                        break;
                    default:
                        throw new IllegalArgumentException("未知选项: " + args[i]);
                }
            }
            return o;
        }
    }

    /**
     * 打印使用说明
     */
    private static void printUsage(PrintStream out) {
        out.println("VZip 归档分析器");
        out.println();
        out.println("用法: java ArchiveAnalyzerCLI <command> [options]");
        out.println();
        out.println("可用命令:");
        out.println("  analyze <archive> [--show-frames]");
        out.println("    分析归档并显示帧统计信息");
        out.println();
        out.println("  validate <archive> [--codec <name>] [--buffer-size <bytes>]");
        out.println("    验证归档结构并尝试解压每一帧");
        out.println();
        out.println("  extract <archive> <output_dir> [--codec <name>] [--buffer-size <bytes>] [--suffix <ext>]");
        out.println("    解压所有帧到目录");
        out.println();
        out.println("  export <archive> <output_file>");
        out.println("    将帧统计导出为JSON格式");
        out.println();
        out.println("  help");
        out.println("    显示此帮助信息");
        out.println();
        out.println("示例:");
        out.println("  java ArchiveAnalyzerCLI analyze video.vzip --show-frames");
        out.println("  java ArchiveAnalyzerCLI extract video.vzip /tmp/frames");
    }
}
