package org.emotion.app.service;

import org.emotion.app.api.DatasetUseCases;
import org.emotion.app.api.dto.DatasetOptions;
import org.emotion.corpus.CorpusMetadata;
import org.emotion.corpus.CorpusRegistry;
import org.emotion.error.SourceReadException;
import org.emotion.io.RawTable;
import org.emotion.io.arff.ArffReaders;
import org.emotion.io.arff.PackedArffDecoder;
import org.emotion.io.audio.AudioDecoder;
import org.emotion.io.audio.RawAudioReader;
import org.emotion.io.audio.WavAudioDecoder;
import org.emotion.io.grid.GriddedArrayOpener;
import org.emotion.io.grid.GriddedArrayReader;
import org.emotion.model.Dataset;
import org.emotion.model.DatasetAssembler;
import org.emotion.model.FrameSequence;
import org.emotion.model.Vector;
import org.emotion.normalize.Normalizer;
import org.emotion.sequence.AggregatedSequences;
import org.emotion.sequence.SequenceAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/** Default pipeline: reader, assembler, normalizer and (for frame files) aggregator. */
public final class DatasetLoadingService implements DatasetUseCases {

    private static final Logger log = LoggerFactory.getLogger(DatasetLoadingService.class);

    private final CorpusRegistry registry;
    private final DatasetOptions options;
    private final ArffReaders arffReaders;
    private final GriddedArrayOpener griddedOpener;
    private final AudioDecoder audioDecoder;

    private final DatasetAssembler assembler = new DatasetAssembler();
    private final Normalizer normalizer = new Normalizer();
    private final SequenceAggregator aggregator = new SequenceAggregator();

    /** Bundled registry, options from the classpath, text attribute files and WAV audio only. */
    public DatasetLoadingService() {
        this(CorpusRegistry.defaultRegistry(), DatasetOptions.load(), null, null, new WavAudioDecoder());
    }

    /**
     * @param packedDecoder decoder for {@code .bin} attribute files, or {@code null}
     * @param griddedOpener opener for gridded-array files, or {@code null}
     */
    public DatasetLoadingService(CorpusRegistry registry,
                                 DatasetOptions options,
                                 PackedArffDecoder packedDecoder,
                                 GriddedArrayOpener griddedOpener,
                                 AudioDecoder audioDecoder) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.arffReaders = new ArffReaders(packedDecoder);
        this.griddedOpener = griddedOpener;
        this.audioDecoder = Objects.requireNonNull(audioDecoder, "audioDecoder must not be null");
    }

    public DatasetOptions options() {
        return options;
    }

    @Override
    public Dataset<Vector> loadUtterances(Path file) {
        RawTable<Vector> table = arffReaders.forPath(file).read(file);
        CorpusMetadata corpus = registry.resolve(declaredCorpus(file, table));

        Dataset<Vector> dataset = normalize(assembler.assemble(table, corpus, options.binarize()));
        log.info("{} instances x {} features", dataset.size(), dataset.nFeatures());
        return dataset;
    }

    @Override
    public Dataset<FrameSequence> loadFrames(Path file) {
        RawTable<Vector> table = arffReaders.forPath(file).read(file);
        CorpusMetadata corpus = registry.resolve(declaredCorpus(file, table));

        // every frame carries the speaker of its instance, so per-speaker fits see all frames
        Dataset<Vector> frames = normalize(assembler.assemble(table, corpus, false));

        AggregatedSequences sequences = aggregator.aggregate(
                Vector.toMatrix(frames.x()), frames.y(), frames.names(), frames.speakerIndices());
        Dataset<FrameSequence> dataset = assembler.build(sequences.names(), sequences.x(), sequences.y(),
                frames.featureNames(), corpus, options.binarize());

        if (options.padMultiple() > 0) {
            Dataset.padSequences(dataset, options.padMultiple());
        }
        return dataset;
    }

    @Override
    public Dataset<Vector> loadGridded(Path file, String corpusId) {
        if (griddedOpener == null) {
            throw new IllegalStateException("No gridded-array opener configured");
        }
        CorpusMetadata corpus = registry.resolve(corpusId);
        GriddedArrayReader reader = new GriddedArrayReader(
                griddedOpener, options.labelSource(), GriddedArrayReader::defaultAnnotations);
        return normalize(assembler.assemble(reader.read(file), corpus, options.binarize()));
    }

    @Override
    public Dataset<FrameSequence> loadRaw(Path fileList, String corpusId) {
        CorpusMetadata corpus = registry.resolve(corpusId);
        RawAudioReader reader = new RawAudioReader(audioDecoder, options.labelSource());
        return assembler.assemble(reader.read(fileList), corpus, options.binarize());
    }

    private Dataset<Vector> normalize(Dataset<Vector> dataset) {
        double[][] x = normalizer.normalize(Vector.toMatrix(dataset.x()), dataset.speakerIndices(),
                dataset.nSpeakers(), options.normalization());
        return dataset.withPayload(Vector.fromMatrix(x));
    }

    private static String declaredCorpus(Path file, RawTable<?> table) {
        return table.corpusId().orElseThrow(() ->
                new SourceReadException(file, "Attribute file declares no relation name"));
    }
}
