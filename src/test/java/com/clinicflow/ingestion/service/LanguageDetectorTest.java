package com.clinicflow.ingestion.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LanguageDetectorTest {

    private final LanguageDetector detector = new LanguageDetector();

    @Test
    void testDetect() {
        assertEquals(LanguageDetector.Language.LATVIAN, detector.detect("Stipras galvassāpes un drudzis"));
        assertEquals(LanguageDetector.Language.LATVIAN, detector.detect("klepus jau nedelu"));
        assertEquals(LanguageDetector.Language.RUSSIAN, detector.detect("Сильная головная боль"));
        assertEquals(LanguageDetector.Language.GERMAN, detector.detect("Starke Kopfschmerzen und Fieber"));
        assertEquals(LanguageDetector.Language.ENGLISH, detector.detect("Acute cough with high temperature"));
        assertEquals(LanguageDetector.Language.ENGLISH, detector.detect("Warm feeling in the left hand"));
        assertEquals(LanguageDetector.Language.ENGLISH, detector.detect(null));
    }

    @Test
    void testValue() {
        assertEquals("latvian", LanguageDetector.Language.LATVIAN.value());
    }
}
