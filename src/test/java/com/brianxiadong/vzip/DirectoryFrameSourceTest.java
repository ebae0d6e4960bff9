package com.brianxiadong.vzip;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

public class DirectoryFrameSourceTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testFiltersAndSortsByName() throws Exception {
        Path dir = folder.newFolder("frames").toPath();
        Files.write(dir.resolve("frame10.ppm"), new byte[]{10});
        Files.write(dir.resolve("frame02.ppm"), new byte[]{2});
        Files.write(dir.resolve("frame01.ppm"), new byte[]{1});
        Files.write(dir.resolve("notes.txt"), new byte[]{0});
        Files.write(dir.resolve("upper.PPM"), new byte[]{0});
        Files.createDirectory(dir.resolve("nested.ppm"));

        DirectoryFrameSource source = new DirectoryFrameSource(dir, ".ppm");
        Assert.assertEquals(3, source.size());
        Assert.assertEquals("frame01.ppm", source.getName(0));
        Assert.assertEquals("frame02.ppm", source.getName(1));
        Assert.assertEquals("frame10.ppm", source.getName(2));

        byte[] buffer = new byte[16];
        Assert.assertEquals(1, source.read(2, buffer));
        Assert.assertEquals(10, buffer[0]);
    }

    @Test
    public void testReadTruncatesToBuffer() throws Exception {
        Path dir = folder.newFolder("big").toPath();
        byte[] data = TestFrames.random(1, 5000);
        Files.write(dir.resolve("a.ppm"), data);

        DirectoryFrameSource source = new DirectoryFrameSource(dir, ".ppm");
        byte[] buffer = new byte[4096];
        Assert.assertEquals(4096, source.read(0, buffer));
        Assert.assertArrayEquals(Arrays.copyOf(data, 4096), buffer);

        byte[] exact = new byte[5000];
        Assert.assertEquals(5000, source.read(0, exact));
    }

    @Test
    public void testEmptyDirectory() throws Exception {
        DirectoryFrameSource source = new DirectoryFrameSource(folder.newFolder("empty").toPath(), ".ppm");
        Assert.assertEquals(0, source.size());
    }

    @Test
    public void testMissingDirectory() {
        try {
            new DirectoryFrameSource(folder.getRoot().toPath().resolve("nope"), ".ppm");
            Assert.fail("missing directory accepted");
        } catch (VZipException e) {
            Assert.assertEquals(VZipException.Kind.SETUP, e.getKind());
        }
    }

    @Test
    public void testDeletedFrameFailsCompression() throws Exception {
        File dir = folder.newFolder("deleted");
        for (int i = 0; i < 4; i++) {
            Files.write(new File(dir, "f" + i + ".ppm").toPath(), TestFrames.ppm(i, 500));
        }
        DirectoryFrameSource source = new DirectoryFrameSource(dir.toPath(), ".ppm");
        Files.delete(new File(dir, "f2.ppm").toPath());

        VZipCompressor c = new VZipCompressor(VZipConfig.builder().workers(2).bufferSize(4096).build(),
                new NoopVZipMetrics());
        try {
            c.compress(source, new java.io.ByteArrayOutputStream());
            Assert.fail("missing frame ignored");
        } catch (VZipException e) {
            Assert.assertEquals(VZipException.Kind.FRAME_IO, e.getKind());
            Assert.assertEquals(2, e.getPosition());
        }
    }
}
