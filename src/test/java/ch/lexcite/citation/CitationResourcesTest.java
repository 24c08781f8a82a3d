package ch.lexcite.citation;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;

@QuarkusTest
class CitationResourcesTest {

    @Test
    void validateReturnsNormalizedCitation() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"citation\": \"BGE 147 IV 73\"}")
        .when()
            .post("/citations/validate")
        .then()
            .statusCode(200)
            .body("valid", equalTo(true))
            .body("type", equalTo("court_decision"))
            .body("language", equalTo("de"))
            .body("normalized", equalTo("BGE 147 IV 73"))
            .body("components.volume", equalTo(147))
            .body("components.chamber", equalTo("IV"));
    }

    @Test
    void validateReportsErrorsForMalformedCitation() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"citation\": \"Art.97 OR\"}")
        .when()
            .post("/citations/validate")
        .then()
            .statusCode(200)
            .body("valid", equalTo(false))
            .body("type", equalTo("statute"))
            .body("errors[0]", startsWith("Missing space"));
    }

    @Test
    void parseAddsSuggestions() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"citation\": \"BGE 147 XX 73\"}")
        .when()
            .post("/citations/parse")
        .then()
            .statusCode(200)
            .body("valid", equalTo(false))
            .body("suggestions", hasItem("Example: BGE 147 IV 73"));
    }

    @Test
    void formatRendersTargetLanguage() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"citation\": \"Art. 97 Abs. 1 OR\", \"targetLanguage\": \"it\", \"fullStatuteName\": true}")
        .when()
            .post("/citations/format")
        .then()
            .statusCode(200)
            .body("citation", equalTo("art. 97 cpv. 1 CO"))
            .body("language", equalTo("it"))
            .body("fullReference", equalTo("art. 97 cpv. 1 CO (Codice delle obbligazioni)"));
    }

    @Test
    void formatRejectsInvalidCitationWithSuggestions() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"citation\": \"BGE 147 VI 73\", \"targetLanguage\": \"fr\"}")
        .when()
            .post("/citations/format")
        .then()
            .statusCode(422)
            .contentType("application/problem+json")
            .body("type", equalTo("urn:lexcite:error:invalid-citation"))
            .body("suggestions", not(hasSize(0)));
    }

    @Test
    void formatRejectsUnsupportedLanguage() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"citation\": \"BGE 147 IV 73\", \"targetLanguage\": \"rm\"}")
        .when()
            .post("/citations/format")
        .then()
            .statusCode(400)
            .body("detail", startsWith("Unsupported language"));
    }

    @Test
    void formatRejectsMissingCitation() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"targetLanguage\": \"fr\"}")
        .when()
            .post("/citations/format")
        .then()
            .statusCode(400)
            .body("type", equalTo("urn:lexcite:error:validation"));
    }

    @Test
    void convertListsAllTranslations() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"citation\": \"ATF 140 III 86\", \"targetLanguage\": \"de\", \"allTranslations\": true}")
        .when()
            .post("/citations/convert")
        .then()
            .statusCode(200)
            .body("sourceLanguage", equalTo("fr"))
            .body("converted.citation", equalTo("BGE 140 III 86"))
            .body("translations.it", equalTo("DTF 140 III 86"));
    }

    @Test
    void extractFindsCitations() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"text\": \"Vgl. BGE 147 IV 73 und Art. 41 OR.\", \"includeTypes\": [\"statute\"]}")
        .when()
            .post("/citations/extract")
        .then()
            .statusCode(200)
            .body("citations.text", contains("Art. 41 OR"))
            .body("statistics.total", equalTo(1));
    }

    @Test
    void standardizeRewritesText() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"text\": \"Vgl. ATF 147 IV 73.\", \"targetLanguage\": \"de\", \"style\": \"short\"}")
        .when()
            .post("/citations/standardize")
        .then()
            .statusCode(200)
            .body("text", equalTo("Vgl. BGE 147 IV 73."))
            .body("replacements", hasSize(1));
    }

    @Test
    void provisionLinksToFedlex() {
        given()
            .contentType(ContentType.JSON)
            .body("{\"statute\": \"ZGB\", \"article\": \"8\", \"language\": \"fr\"}")
        .when()
            .post("/citations/provision")
        .then()
            .statusCode(200)
            .body("abbreviation", equalTo("CC"))
            .body("reference", equalTo("art. 8 CC"))
            .body("fedlexUrl", equalTo("https://www.fedlex.admin.ch/eli/cc/210/fr"));
    }
}
