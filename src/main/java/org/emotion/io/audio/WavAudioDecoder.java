package org.emotion.io.audio;

import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads mono linear PCM (8/16/24/32-bit integer or 32-bit float) through javax.sound.sampled.
 * Samples are scaled to [-1, 1]; the sample rate is left as recorded.
 */
public final class WavAudioDecoder implements AudioDecoder {

    @Override
    public float[] decode(Path file) throws IOException {
        try (InputStream raw = new BufferedInputStream(Files.newInputStream(file));
             AudioInputStream ais = AudioSystem.getAudioInputStream(raw)) {

            AudioFormat f = ais.getFormat();
            if (f.getChannels() != 1) {
                throw new IOException("Expected mono audio but found " + f.getChannels() + " channels");
            }
            byte[] bytes = ais.readAllBytes();
            return toSamples(bytes, f);
        } catch (UnsupportedAudioFileException e) {
            throw new IOException("Unsupported audio file: " + file, e);
        }
    }

    static float[] toSamples(byte[] bytes, AudioFormat f) throws IOException {
        int bits = f.getSampleSizeInBits();
        int width = bits / 8;
        if (bits % 8 != 0 || width < 1 || width > 4) {
            throw new IOException("Unsupported sample size: " + bits + " bits");
        }
        AudioFormat.Encoding enc = f.getEncoding();
        boolean signed = AudioFormat.Encoding.PCM_SIGNED.equals(enc);
        boolean unsigned = AudioFormat.Encoding.PCM_UNSIGNED.equals(enc);
        boolean floating = AudioFormat.Encoding.PCM_FLOAT.equals(enc);
        if (!signed && !unsigned && !(floating && width == 4)) {
            throw new IOException("Unsupported encoding: " + enc + " with " + bits + " bits");
        }

        int n = bytes.length / width;
        float[] out = new float[n];
        boolean big = f.isBigEndian();
        double full = Math.pow(2, bits - 1);

        for (int i = 0; i < n; i++) {
            int off = i * width;
            int v = 0;
            for (int b = 0; b < width; b++) {
                int shift = big ? 8 * (width - 1 - b) : 8 * b;
                v |= (bytes[off + b] & 0xFF) << shift;
            }
            if (floating) {
                out[i] = Float.intBitsToFloat(v);
            } else if (unsigned) {
                out[i] = (float) ((v - full) / full);
            } else {
                // sign-extend from the sample width
                int ext = 32 - bits;
                out[i] = (float) (((v << ext) >> ext) / full);
            }
        }
        return out;
    }
}
