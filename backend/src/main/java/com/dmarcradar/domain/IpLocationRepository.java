package com.dmarcradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for the IP geolocation cache (id = IP literal).
 */
public interface IpLocationRepository extends MongoRepository<IpLocation, String> {
}
