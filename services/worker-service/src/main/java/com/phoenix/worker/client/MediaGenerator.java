package com.phoenix.worker.client;

import com.phoenix.worker.domain.MediaAsset;

public interface MediaGenerator {

    MediaAsset generateAsset(String subjectId, String role, String prompt);
}
