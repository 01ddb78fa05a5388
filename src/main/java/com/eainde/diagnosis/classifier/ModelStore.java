package com.eainde.diagnosis.classifier;

import com.eainde.diagnosis.exception.ModelStoreException;

/**
 * Source of the pre-trained classifier. Read once at startup; nothing is written back.
 */
public interface ModelStore {

    ModelArtifacts load() throws ModelStoreException;
}
