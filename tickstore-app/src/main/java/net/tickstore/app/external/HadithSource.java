package net.tickstore.app.external;

public interface HadithSource {
    /** One hadith text, picked at random. */
    String randomHadith() throws Exception;
}
