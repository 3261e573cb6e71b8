package com.dmarcradar.api.controller;

import com.dmarcradar.domain.DmarcRecordRepository;
import com.dmarcradar.domain.DmarcReportRepository;
import com.dmarcradar.geo.queue.IpLookupQueueService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpEntity;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.io.IOException;
import java.io.InputStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Upload, third-party sender CRUD, geolocation settings and reprocessing endpoints against a real MongoDB.
 * The lookup queue is mocked so no provider is called.
 */
@SpringBootTest(properties = {
        "dmarcradar.geo.startup-scan-limit=0",
        "dmarcradar.ingestion.import-directory="
})
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class DmarcApiIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    DmarcReportRepository dmarcReportRepository;
    @Autowired
    DmarcRecordRepository dmarcRecordRepository;

    @MockBean
    IpLookupQueueService ipLookupQueueService;

    @Test
    @DisplayName("upload stores the report and re-upload replaces its records")
    void uploadIsIdempotent() throws IOException {
        byte[] xml = fixture("aggregate-single.xml");

        webTestClient.post().uri("/api/v1/reports/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart(xml, "google.com!example.com.xml")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.reportId").isEqualTo("13902847104625377214")
                .jsonPath("$.recordCount").isEqualTo(1)
                .jsonPath("$.replaced").isEqualTo(false);

        webTestClient.post().uri("/api/v1/reports/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart(xml, "google.com!example.com.xml")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.replaced").isEqualTo(true);

        String id = dmarcReportRepository.findByReportId("13902847104625377214").orElseThrow().getId();
        assertThat(dmarcRecordRepository.findByDmarcReportId(id)).hasSize(1)
                .allSatisfy(r -> assertThat(r.getForwarded()).isTrue());
    }

    @Test
    @DisplayName("unsupported upload is rejected with INVALID_REPORT")
    void unsupportedUpload() {
        webTestClient.post().uri("/api/v1/reports/upload")
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(multipart("%PDF-1.4".getBytes(), "report.pdf")))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_REPORT");
    }

    @Test
    @DisplayName("third-party sender create, validation and not-found codes")
    void thirdPartySenders() {
        webTestClient.post().uri("/api/v1/third-party-senders")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"name":"SendGrid","dkimPattern":"sendgrid\\\\.net$"}
                        """)
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").exists()
                .jsonPath("$.enabled").isEqualTo(true);

        webTestClient.post().uri("/api/v1/third-party-senders")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"name":"Broken","dkimPattern":"(unclosed"}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_PATTERN");

        webTestClient.post().uri("/api/v1/third-party-senders")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"name":"  "}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_NAME");

        webTestClient.get().uri("/api/v1/third-party-senders/does-not-exist")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("SENDER_NOT_FOUND");
    }

    @Test
    @DisplayName("geolocation settings can be read and replaced at runtime")
    void geoConfig() {
        webTestClient.put().uri("/api/v1/ip-lookup/config")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"primaryProvider":"ipwhois","fallbackProviders":["ip-api"],"useCache":true,"cacheTtlDays":7}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.primaryProvider").isEqualTo("ipwhois")
                .jsonPath("$.cacheTtlDays").isEqualTo(7);

        webTestClient.put().uri("/api/v1/ip-lookup/config")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"fallbackProviders":[]}
                        """)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_PROVIDER");

        webTestClient.get().uri("/api/v1/ip-lookup/providers")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(5);
    }

    @Test
    void unknownReprocessingJob() {
        webTestClient.get().uri("/api/v1/reprocessing/jobs/nope")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("JOB_NOT_FOUND");
    }

    private static MultiValueMap<String, HttpEntity<?>> multipart(byte[] content, String fileName) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", content).filename(fileName).contentType(MediaType.APPLICATION_OCTET_STREAM);
        return builder.build();
    }

    private static byte[] fixture(String name) throws IOException {
        try (InputStream in = DmarcApiIntegrationTest.class.getResourceAsStream("/fixtures/" + name)) {
            return in.readAllBytes();
        }
    }
}
