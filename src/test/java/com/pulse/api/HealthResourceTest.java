package com.pulse.api;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.notNullValue;

@QuarkusTest
class HealthResourceTest {

    @Test
    void reportsStatusAndClientCount() {
        given()
                .when()
                .get("/api/health")
                .then()
                .statusCode(200)
                .body("status", equalTo("ok"))
                .body("clients", greaterThanOrEqualTo(0))
                .body("uptimeMillis", notNullValue())
                .body("timestamp", notNullValue());
    }
}
