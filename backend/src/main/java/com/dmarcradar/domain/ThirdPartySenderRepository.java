package com.dmarcradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ThirdPartySenderRepository extends MongoRepository<ThirdPartySender, String> {

    List<ThirdPartySender> findAllByOrderByNameAsc();

    List<ThirdPartySender> findByEnabledTrueOrderByNameAsc();
}
