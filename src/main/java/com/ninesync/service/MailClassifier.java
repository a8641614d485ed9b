package com.ninesync.service;

/**
 * Decides the destination of an incoming message from its raw bytes
 * (header block followed by the first body part).
 */
public interface MailClassifier {

    Classification classify(byte[] rawMessage);
}
