package com.brianxiadong.vzip;

import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

public class ArchiveFormatTest {

    @Test
    public void testFrameLayout() throws Exception {
        ResultsTable t = new ResultsTable(2);
        t.fill(0, CompressedFrame.wrap(new byte[]{10, 11, 12}));
        t.fill(1, CompressedFrame.wrap(new byte[0]));

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long written = new ArchiveWriter().write(t, out);
        Assert.assertEquals(4 + 3 + 4, written);

        byte[] expected = {3, 0, 0, 0, 10, 11, 12, 0, 0, 0, 0};
        Assert.assertArrayEquals(expected, out.toByteArray());
    }

    @Test
    public void testLengthIsLittleEndian() {
        byte[] header = new byte[4];
        ArchiveFormat.encodeLength(0x01020304, header);
        Assert.assertArrayEquals(new byte[]{4, 3, 2, 1}, header);
        Assert.assertEquals(0x01020304, ArchiveFormat.decodeLength(header));
    }

    @Test
    public void testReaderReturnsFramesInOrder() throws Exception {
        ResultsTable t = new ResultsTable(3);
        t.fill(2, CompressedFrame.wrap(new byte[]{3, 3, 3}));
        t.fill(0, CompressedFrame.wrap(new byte[]{1}));
        t.fill(1, CompressedFrame.wrap(new byte[]{2, 2}));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new ArchiveWriter().write(t, out);

        List<CompressedFrame> frames = ArchiveReader.readAll(new ByteArrayInputStream(out.toByteArray()));
        Assert.assertEquals(3, frames.size());
        for (int i = 0; i < 3; i++) {
            Assert.assertEquals(i + 1, frames.get(i).getLength());
            Assert.assertEquals(i + 1, frames.get(i).getData()[0]);
        }
    }

    @Test
    public void testEmptyArchive() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Assert.assertEquals(0, new ArchiveWriter().write(new ResultsTable(0), out));
        Assert.assertEquals(0, out.size());
        Assert.assertTrue(ArchiveReader.readAll(new ByteArrayInputStream(new byte[0])).isEmpty());
    }

    @Test(expected = IllegalStateException.class)
    public void testWriterRejectsMissingSlot() throws Exception {
        ResultsTable t = new ResultsTable(2);
        t.fill(0, CompressedFrame.wrap(new byte[]{1}));
        new ArchiveWriter().write(t, new ByteArrayOutputStream());
    }

    @Test
    public void testTruncatedPayload() throws Exception {
        byte[] archive = {5, 0, 0, 0, 1, 2, 3};
        ArchiveReader reader = new ArchiveReader(new ByteArrayInputStream(archive));
        try {
            reader.next();
            Assert.fail("truncated payload accepted");
        } catch (EOFException expected) {
            Assert.assertTrue(expected.getMessage().contains("frame 0"));
        }
    }

    @Test(expected = EOFException.class)
    public void testTruncatedLengthField() throws Exception {
        byte[] archive = {1, 0, 0, 0, 9, 2, 0};
        ArchiveReader reader = new ArchiveReader(new ByteArrayInputStream(archive));
        Assert.assertArrayEquals(new byte[]{9}, reader.next().getData());
        reader.next();
    }

    @Test
    public void testNegativeLength() {
        byte[] archive = new byte[8];
        Arrays.fill(archive, (byte) 0xFF);
        try {
            ArchiveReader.readAll(new ByteArrayInputStream(archive));
            Assert.fail("negative length accepted");
        } catch (IOException expected) {
            Assert.assertTrue(expected.getMessage().contains("negative"));
        }
    }

    @Test
    public void testOversizedLengthWithoutPayload() throws Exception {
        byte[] archive = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, 0x7F, 1, 2, 3};
        try {
            new ArchiveReader(new ByteArrayInputStream(archive)).next();
            Assert.fail("missing payload accepted");
        } catch (EOFException expected) {
            Assert.assertTrue(expected.getMessage().contains("got 3"));
        }

        try {
            new ArchiveReader(new ByteArrayInputStream(archive), archive.length).next();
            Assert.fail("length over limit accepted");
        } catch (IOException expected) {
            Assert.assertTrue(expected.getMessage().contains("exceeds limit"));
        }
    }

    @Test
    public void testPayloadLargerThanReadChunk() throws Exception {
        byte[] payload = TestFrames.random(7, ArchiveReader.READ_CHUNK * 3 + 17);
        byte[] header = new byte[ArchiveFormat.LENGTH_FIELD_SIZE];
        ArchiveFormat.encodeLength(payload.length, header);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(header);
        out.write(payload);

        ArchiveReader reader = new ArchiveReader(new ByteArrayInputStream(out.toByteArray()), payload.length);
        CompressedFrame f = reader.next();
        Assert.assertEquals(payload.length, f.getLength());
        Assert.assertArrayEquals(payload, f.getData());
        Assert.assertNull(reader.next());
    }
}
