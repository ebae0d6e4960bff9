package com.brianxiadong.vzip;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 目录中按文件名字典序排列的帧文件
 */
public class DirectoryFrameSource implements FrameSource {
    private final Path directory;
    private final List<String> names;

    public DirectoryFrameSource(Path directory, String suffix) throws VZipException {
        this.directory = directory;
        this.names = list(directory, suffix);
    }

    private static List<String> list(Path directory, String suffix) throws VZipException {
        if (!Files.isDirectory(directory)) {
            throw new VZipException(VZipException.Kind.SETUP, "not a directory: " + directory, null);
        }
        List<String> res = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                if (name.endsWith(suffix) && Files.isRegularFile(p)) {
                    res.add(name);
                }
            }
        } catch (IOException e) {
            throw new VZipException(VZipException.Kind.SETUP, "cannot list " + directory, e);
        }
        Collections.sort(res);
        return res;
    }

    @Override
    public int size() {
        return names.size();
    }

    @Override
    public String getName(int position) {
        return names.get(position);
    }

    @Override
    public int read(int position, byte[] buffer) throws IOException {
        try (InputStream in = Files.newInputStream(directory.resolve(names.get(position)))) {
            int len = 0;
            while (len < buffer.length) {
                int n = in.read(buffer, len, buffer.length - len);
                if (n < 0)
                    break;
                len += n;
            }
            // 超出缓冲区的部分被截断
            return len;
        }
    }
}
