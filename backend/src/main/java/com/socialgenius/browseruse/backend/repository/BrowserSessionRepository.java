package com.socialgenius.browseruse.backend.repository;

import com.socialgenius.browseruse.backend.model.BrowserSession;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BrowserSessionRepository extends MongoRepository<BrowserSession, String> {
}
