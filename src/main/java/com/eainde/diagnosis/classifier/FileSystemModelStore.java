package com.eainde.diagnosis.classifier;

import com.eainde.diagnosis.exception.ModelStoreException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the classifier artifacts written by the training job from one directory:
 * <ul>
 *   <li>{@code disease_model_final.json}: exported random forest</li>
 *   <li>{@code feature_names_final.csv}: one feature name per line, no header</li>
 *   <li>{@code disease_mapping.csv}: {@code class_id,class_name} with header</li>
 * </ul>
 */
@Log4j2
public class FileSystemModelStore implements ModelStore {

    public static final String MODEL_FILE = "disease_model_final.json";
    public static final String FEATURES_FILE = "feature_names_final.csv";
    public static final String MAPPING_FILE = "disease_mapping.csv";

    private static final String RANDOM_FOREST = "random_forest";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final CsvMapper csvMapper;

    public FileSystemModelStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.csvMapper = new CsvMapper();
    }

    @Override
    public ModelArtifacts load() throws ModelStoreException {
        log.info("Loading classifier artifacts from {}", directory.toAbsolutePath());

        Path modelPath = require(MODEL_FILE);
        Path featuresPath = require(FEATURES_FILE);
        Path mappingPath = require(MAPPING_FILE);

        List<String> schema = readFeatureNames(featuresPath);
        Map<Integer, String> labels = readLabelMapping(mappingPath);
        RandomForestModel model = readModel(modelPath);

        if (model.featureCount() != schema.size()) {
            throw new ModelStoreException("Model expects " + model.featureCount()
                    + " features but " + FEATURES_FILE + " lists " + schema.size());
        }
        for (int classId = 0; classId < model.classCount(); classId++) {
            if (!labels.containsKey(classId)) {
                throw new ModelStoreException("No label for class id " + classId + " in " + MAPPING_FILE);
            }
        }

        log.info("Classifier loaded: {} trees, {} features, {} classes",
                model.treeCount(), schema.size(), model.classCount());
        return new ModelArtifacts(model, schema, labels);
    }

    private Path require(String fileName) throws ModelStoreException {
        Path path = directory.resolve(fileName);
        if (!Files.isRegularFile(path)) {
            throw new ModelStoreException("Model artifact missing: " + path.toAbsolutePath());
        }
        return path;
    }

    private List<String> readFeatureNames(Path path) throws ModelStoreException {
        try (MappingIterator<List<String>> rows = csvMapper.readerForListOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .readValues(path.toFile())) {
            List<String> names = new ArrayList<>();
            while (rows.hasNext()) {
                List<String> row = rows.next();
                if (!row.isEmpty() && !row.get(0).isBlank()) {
                    names.add(row.get(0).trim());
                }
            }
            if (names.isEmpty()) {
                throw new ModelStoreException(FEATURES_FILE + " is empty");
            }
            return names;
        } catch (IOException e) {
            throw new ModelStoreException("Cannot read " + path, e);
        }
    }

    private Map<Integer, String> readLabelMapping(Path path) throws ModelStoreException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(path.toFile())) {
            Map<Integer, String> labels = new LinkedHashMap<>();
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                String id = row.get("class_id");
                String name = row.get("class_name");
                if (id == null || name == null) {
                    throw new ModelStoreException(MAPPING_FILE + " needs class_id and class_name columns");
                }
                labels.put(Integer.parseInt(id.trim()), name.trim());
            }
            return labels;
        } catch (NumberFormatException e) {
            throw new ModelStoreException("Non-numeric class_id in " + path, e);
        } catch (IOException e) {
            throw new ModelStoreException("Cannot read " + path, e);
        }
    }

    private RandomForestModel readModel(Path path) throws ModelStoreException {
        try {
            RandomForestModel.Artifact artifact = objectMapper.readValue(path.toFile(), RandomForestModel.Artifact.class);
            if (artifact.modelType() != null && !RANDOM_FOREST.equals(artifact.modelType())) {
                throw new ModelStoreException("Unsupported model_type '" + artifact.modelType() + "'");
            }
            return new RandomForestModel(artifact);
        } catch (IllegalArgumentException e) {
            throw new ModelStoreException("Invalid model in " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ModelStoreException("Cannot read " + path, e);
        }
    }
}
