import org.emotion.error.MissingLabelException;
import org.emotion.error.SourceReadException;
import org.emotion.io.FileNames;
import org.emotion.io.LabelSource;
import org.emotion.io.RawTable;
import org.emotion.io.annotation.AnnotationFiles;
import org.emotion.io.arff.ArffAttribute;
import org.emotion.io.arff.ArffParser;
import org.emotion.io.arff.ArffReader;
import org.emotion.io.arff.ArffReaders;
import org.emotion.io.arff.ArffRelation;
import org.emotion.io.arff.PackedArffReader;
import org.emotion.io.audio.RawAudioReader;
import org.emotion.io.audio.WavAudioDecoder;
import org.emotion.io.grid.GriddedArrayContainer;
import org.emotion.io.grid.GriddedArrayReader;
import org.emotion.model.FrameSequence;
import org.emotion.model.Vector;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * A single test file that covers the readers:
 * - ArffParser / ArffReader / PackedArffReader / ArffReaders
 * - AnnotationFiles (classification + regression)
 * - GriddedArrayReader (label join, sorting, closing)
 * - RawAudioReader + WavAudioDecoder
 */
public class IoTest {

    private static final String TOY_ARFF = String.join("\n",
            "% toy corpus",
            "@relation toy",
            "",
            "@attribute name string",
            "@attribute 'mfcc 1' numeric",
            "@attribute energy real",
            "@attribute class {A,D,N}",
            "",
            "@data",
            "'01_A_1',0.5,1,A",
            "'02_D_1',1.5,2,D",
            "% comment inside data",
            "01_A_2, 2.5 , 3,A",
            "\"02_N_1\",3.5,4,N");

    // ----------------------------
    // Attribute-relation files
    // ----------------------------
    @Nested
    class ArffTests {

        @TempDir
        Path tempDir;

        @Test
        void parser_readsHeaderTypesQuotesAndMissingValues() throws IOException {
            String text = String.join("\n",
                    "@RELATION 'my corpus'",
                    "@ATTRIBUTE name STRING",
                    "@ATTRIBUTE x NUMERIC",
                    "@ATTRIBUTE label {'a b',c}",
                    "@DATA",
                    "'it\\'s',?,'a b'",
                    "n2,-1e-3,c");
            ArffRelation rel = new ArffParser().parse(new StringReader(text));

            assertEquals("my corpus", rel.relation());
            assertEquals(3, rel.attributes().size());
            assertEquals(ArffAttribute.Type.NOMINAL, rel.attributes().get(2).type());
            assertEquals(List.of("a b", "c"), rel.attributes().get(2).nominalValues());
            assertEquals("it's", rel.data().get(0).get(0));
            assertNull(rel.data().get(0).get(1));
            assertEquals(-1e-3, (Double) rel.data().get(1).get(1), 1e-12);
        }

        @Test
        void parser_rejectsUndeclaredNominalValue() {
            String text = "@relation r\n@attribute n string\n@attribute c {A}\n@data\nx,B\n";
            ArffParser.ArffFormatException ex = assertThrows(ArffParser.ArffFormatException.class,
                    () -> new ArffParser().parse(new StringReader(text)));
            assertEquals(5, ex.line());
        }

        @Test
        void parser_rejectsWrongRowWidth_andSparseRows() {
            String wide = "@relation r\n@attribute n string\n@attribute x numeric\n@data\na,1,2\n";
            assertThrows(ArffParser.ArffFormatException.class, () -> new ArffParser().parse(new StringReader(wide)));

            String sparse = "@relation r\n@attribute n string\n@attribute x numeric\n@data\n{1 2}\n";
            assertThrows(ArffParser.ArffFormatException.class, () -> new ArffParser().parse(new StringReader(sparse)));
        }

        @Test
        void reader_mapsNameFeaturesAndLabelColumns() throws IOException {
            Path file = tempDir.resolve("toy.arff");
            Files.writeString(file, TOY_ARFF, StandardCharsets.UTF_8);

            RawTable<Vector> table = new ArffReader().read(file);

            assertEquals(List.of("01_A_1", "02_D_1", "01_A_2", "02_N_1"), table.names());
            assertEquals(List.of("A", "D", "A", "N"), table.labelTokens());
            assertEquals(List.of("mfcc 1", "energy"), table.attributeNames());
            assertEquals(new Vector(new double[]{2.5, 3}), table.rows().get(2));
            assertEquals("toy", table.corpusId().orElseThrow());
        }

        @Test
        void reader_missingFile_isSourceReadError() {
            assertThrows(SourceReadException.class, () -> new ArffReader().read(tempDir.resolve("nope.arff")));
        }

        @Test
        void reader_malformedFile_isSourceReadError() throws IOException {
            Path file = tempDir.resolve("bad.arff");
            Files.writeString(file, "not an attribute file\n");
            assertThrows(SourceReadException.class, () -> new ArffReader().read(file));
        }

        @Test
        void reader_nonNumericFeature_isSourceReadError() throws IOException {
            Path file = tempDir.resolve("strings.arff");
            Files.writeString(file, "@relation r\n@attribute n string\n@attribute x string\n@attribute c string\n@data\na,abc,L\n");
            assertThrows(SourceReadException.class, () -> new ArffReader().read(file));
        }

        @Test
        void packedReader_delegatesBytesToDecoder() throws IOException {
            Path file = tempDir.resolve("frames.arff.bin");
            byte[] payload = {1, 2, 3};
            Files.write(file, payload);

            ArffRelation relation = new ArffRelation("toy",
                    List.of(ArffAttribute.string("name"), ArffAttribute.numeric("x"), ArffAttribute.string("label")),
                    List.of(Arrays.<Object>asList("01_A_1", 4.0, "A")));
            List<byte[]> seen = new ArrayList<>();

            RawTable<Vector> table = new PackedArffReader(bytes -> {
                seen.add(bytes);
                return relation;
            }).read(file);

            assertArrayEquals(payload, seen.get(0));
            assertEquals(List.of("01_A_1"), table.names());
            assertEquals(4.0, table.rows().get(0).get(0));
        }

        @Test
        void packedReader_decoderFailure_isSourceReadError() throws IOException {
            Path file = tempDir.resolve("broken.bin");
            Files.write(file, new byte[]{0});
            PackedArffReader reader = new PackedArffReader(bytes -> {
                throw new IOException("bad header");
            });
            assertThrows(SourceReadException.class, () -> reader.read(file));
        }

        @Test
        void readers_dispatchOnExtension() {
            ArffReaders readers = new ArffReaders(bytes -> null);
            assertInstanceOf(PackedArffReader.class, readers.forPath(Path.of("x", "logmel.arff.bin")));
            assertInstanceOf(ArffReader.class, readers.forPath(Path.of("x", "logmel.arff")));
            assertThrows(IllegalStateException.class,
                    () -> new ArffReaders(null).forPath(Path.of("logmel.BIN")));
        }
    }

    // ----------------------------
    // Annotation files
    // ----------------------------
    @Nested
    class AnnotationTests {

        @TempDir
        Path tempDir;

        @Test
        void classification_mapsNameToLabel() throws IOException {
            Path file = tempDir.resolve("labels.csv");
            Files.writeString(file, "name,label\n03a01Fa,happiness\n\"08b02Wa\",anger\n");

            Map<String, String> labels = AnnotationFiles.classification(file);
            assertEquals(Map.of("03a01Fa", "happiness", "08b02Wa", "anger"), labels);
        }

        @Test
        void regression_mapsNameToNamedColumns() throws IOException {
            Path file = tempDir.resolve("dims.csv");
            Files.writeString(file, "name,arousal,valence\nu1,0.5,-1\nu2,1,2.25\n");

            Map<String, Map<String, Double>> dims = AnnotationFiles.regression(file);
            assertEquals(List.of("u1", "u2"), List.copyOf(dims.keySet()));
            assertEquals(-1.0, dims.get("u1").get("valence"));
            assertEquals(2.25, dims.get("u2").get("valence"));
        }

        @Test
        void repeatedName_isSourceReadError() throws IOException {
            Path labels = tempDir.resolve("labels.csv");
            Files.writeString(labels, "name,label\nu1,anger\nu2,sad\nu1,happy\n");
            assertThrows(SourceReadException.class, () -> AnnotationFiles.classification(labels));

            Path dims = tempDir.resolve("dims.csv");
            Files.writeString(dims, "name,arousal\nu1,1\nu1,2\n");
            assertThrows(SourceReadException.class, () -> AnnotationFiles.regression(dims));
        }

        @Test
        void regression_nonNumericValue_isSourceReadError() throws IOException {
            Path file = tempDir.resolve("dims.csv");
            Files.writeString(file, "name,arousal\nu1,high\n");
            assertThrows(SourceReadException.class, () -> AnnotationFiles.regression(file));
        }

        @Test
        void missingFile_isSourceReadError() {
            assertThrows(SourceReadException.class, () -> AnnotationFiles.classification(tempDir.resolve("x.csv")));
        }
    }

    // ----------------------------
    // Gridded arrays
    // ----------------------------
    @Nested
    class GriddedTests {

        @TempDir
        Path tempDir;

        private final AtomicBoolean closed = new AtomicBoolean();

        private GriddedArrayContainer container(double[][] features, List<String> filenames) {
            return new GriddedArrayContainer() {
                @Override
                public double[][] matrix(String variable) {
                    assertEquals(GriddedArrayReader.FEATURES_VARIABLE, variable);
                    return features;
                }

                @Override
                public List<String> strings(String variable) {
                    assertEquals(GriddedArrayReader.FILENAME_VARIABLE, variable);
                    return filenames;
                }

                @Override
                public void close() {
                    closed.set(true);
                }
            };
        }

        private Path featureFile() throws IOException {
            Path dir = Files.createDirectories(tempDir.resolve("features"));
            Path file = dir.resolve("audeep.nc");
            Files.write(file, new byte[]{0});
            return file;
        }

        @Test
        void joinsLabels_sortsByName_andClosesContainer() throws IOException {
            Path file = featureFile();
            Files.writeString(tempDir.resolve("labels.csv"), "name,label\nb,anger\na,neutral\nc,anger\n");

            GriddedArrayReader reader = new GriddedArrayReader(p -> container(
                    new double[][]{{2, 2}, {1, 1}, {3, 3}},
                    List.of("wav/b.wav", "wav/a.wav", "wav/c.wav")));
            RawTable<Vector> table = reader.read(file);

            assertTrue(closed.get());
            assertEquals(List.of("a", "b", "c"), table.names());
            assertEquals(List.of("neutral", "anger", "anger"), table.labelTokens());
            assertEquals(1.0, table.rows().get(0).get(0));
            assertEquals(List.of("representation_1", "representation_2"), table.attributeNames());
            assertTrue(table.corpusId().isEmpty());
        }

        @Test
        void nameWithoutAnnotation_isMissingLabel_andContainerStillClosed() throws IOException {
            Path file = featureFile();
            Files.writeString(tempDir.resolve("labels.csv"), "name,label\na,neutral\n");

            GriddedArrayReader reader = new GriddedArrayReader(p -> container(
                    new double[][]{{1}, {2}}, List.of("a.wav", "zz.wav")));

            MissingLabelException ex = assertThrows(MissingLabelException.class, () -> reader.read(file));
            assertEquals("zz", ex.instanceName());
            assertTrue(closed.get());
        }

        @Test
        void nameLabelSource_leavesTableUnlabelled() throws IOException {
            Path file = featureFile();
            GriddedArrayReader reader = new GriddedArrayReader(p -> container(new double[][]{{1}}, List.of("a.wav")),
                    LabelSource.NAMES, GriddedArrayReader::defaultAnnotations);

            RawTable<Vector> table = reader.read(file);
            assertFalse(table.isLabelled());
        }

        @Test
        void openFailure_isSourceReadError() {
            GriddedArrayReader reader = new GriddedArrayReader(p -> {
                throw new IOException("not a gridded file");
            });
            assertThrows(SourceReadException.class, () -> reader.read(tempDir.resolve("x.nc")));
        }

        @Test
        void rowCountMismatch_isSourceReadError() throws IOException {
            Path file = featureFile();
            GriddedArrayReader reader = new GriddedArrayReader(p -> container(new double[][]{{1}}, List.of("a", "b")));
            assertThrows(SourceReadException.class, () -> reader.read(file));
        }
    }

    // ----------------------------
    // Raw audio
    // ----------------------------
    @Nested
    class RawAudioTests {

        @TempDir
        Path tempDir;

        private Path writeWav(String name, short... samples) throws IOException {
            ByteBuffer bb = ByteBuffer.allocate(samples.length * 2).order(ByteOrder.LITTLE_ENDIAN);
            for (short s : samples) {
                bb.putShort(s);
            }
            byte[] bytes = bb.array();
            AudioFormat format = new AudioFormat(16000, 16, 1, true, false);
            Path file = tempDir.resolve(name);
            try (AudioInputStream ais = new AudioInputStream(new ByteArrayInputStream(bytes), format, samples.length)) {
                AudioSystem.write(ais, AudioFileFormat.Type.WAVE, file.toFile());
            }
            return file;
        }

        @Test
        void decoder_scalesPcm16ToUnitRange() throws IOException {
            Path wav = writeWav("x.wav", (short) 0, (short) 16384, (short) -32768);
            float[] samples = new WavAudioDecoder().decode(wav);
            assertArrayEquals(new float[]{0f, 0.5f, -1f}, samples, 1e-6f);
        }

        @Test
        void reader_buildsSingleChannelSequences_withJoinedLabels() throws IOException {
            Path a = writeWav("03a01Fa.wav", (short) 1, (short) 2, (short) 3);
            Path b = writeWav("08b02Wa.wav", (short) 4);
            Path list = tempDir.resolve("files.txt");
            Files.writeString(list, a + "\n\n" + b + "\n");
            Files.writeString(tempDir.resolve(RawAudioReader.ANNOTATION_FILE), "name,label\n03a01Fa,F\n08b02Wa,W\n");

            RawTable<FrameSequence> table = new RawAudioReader().read(list);

            assertEquals(List.of("03a01Fa", "08b02Wa"), table.names());
            assertEquals(List.of("F", "W"), table.labelTokens());
            assertEquals(List.of("pcm"), table.attributeNames());
            assertEquals(3, table.rows().get(0).length());
            assertEquals(1, table.rows().get(0).dim());
        }

        @Test
        void reader_missingAnnotation_isMissingLabel() throws IOException {
            Path a = writeWav("03a01Fa.wav", (short) 1);
            Path list = tempDir.resolve("files.txt");
            Files.writeString(list, a + "\n");
            Files.writeString(tempDir.resolve(RawAudioReader.ANNOTATION_FILE), "name,label\nother,F\n");

            assertThrows(MissingLabelException.class, () -> new RawAudioReader().read(list));
        }

        @Test
        void reader_undecodableFile_isSourceReadError() throws IOException {
            Path junk = tempDir.resolve("junk.wav");
            Files.writeString(junk, "definitely not audio");
            Path list = tempDir.resolve("files.txt");
            Files.writeString(list, junk + "\n");

            RawAudioReader reader = new RawAudioReader(new WavAudioDecoder(), LabelSource.NAMES);
            assertThrows(SourceReadException.class, () -> reader.read(list));
        }

        @Test
        void reader_missingList_isSourceReadError() {
            assertThrows(SourceReadException.class, () -> new RawAudioReader().read(tempDir.resolve("none.txt")));
        }
    }

    @Test
    void fileNames_stem_dropsDirectoriesAndLastExtension() {
        assertEquals("03a01Fa", FileNames.stem("/data/emodb/wav/03a01Fa.wav"));
        assertEquals("a.b", FileNames.stem("C:\\x\\a.b.wav"));
        assertEquals(".hidden", FileNames.stem(".hidden"));
    }
}
