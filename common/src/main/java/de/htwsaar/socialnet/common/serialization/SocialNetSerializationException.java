package de.htwsaar.socialnet.common.serialization;

public class SocialNetSerializationException extends RuntimeException {

    public SocialNetSerializationException(String message) {

        super(message);
    }

    public SocialNetSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}
