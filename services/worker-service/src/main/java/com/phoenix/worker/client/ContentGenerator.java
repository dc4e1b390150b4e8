package com.phoenix.worker.client;

import com.phoenix.worker.domain.ContentDraft;

public interface ContentGenerator {

    ContentDraft generateCompanyProfile(GenerationContext context);

    ContentDraft generateArticle(GenerationContext context);
}
