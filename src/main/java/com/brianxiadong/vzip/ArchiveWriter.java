package com.brianxiadong.vzip;

import java.io.IOException;
import java.io.OutputStream;

/**
 * 按位置 0..N-1 顺序把结果表写成归档
 * 只在所有 worker 结束后调用
 */
public class ArchiveWriter {
    private final byte[] header = new byte[ArchiveFormat.LENGTH_FIELD_SIZE];

    /**
     * @return 写入的总字节数
     */
    public long write(ResultsTable results, OutputStream out) throws IOException {
        long written = 0;
        for (int i = 0; i < results.size(); i++) {
            written += writeFrame(results.get(i), out);
        }
        out.flush();
        return written;
    }

    public long writeFrame(CompressedFrame frame, OutputStream out) throws IOException {
        ArchiveFormat.encodeLength(frame.getLength(), header);
        out.write(header);
        out.write(frame.getData());
        return ArchiveFormat.LENGTH_FIELD_SIZE + (long) frame.getLength();
    }
}
