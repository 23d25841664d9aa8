package com.mimecast.sendeml.mime;

import com.mimecast.sendeml.mime.headers.HeaderRewriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Raw message transformer.
 *
 * <p>Prepares the bytes sent after DATA.
 * <br>With no update requested the input array itself is returned.
 * <br>Otherwise a newly allocated array is built and the input is left untouched.
 *
 * @see MessageSplitter
 * @see HeaderRewriter
 */
public class MessageTransformer {
    private static final Logger log = LogManager.getLogger(MessageTransformer.class);

    /**
     * Header rewriter instance.
     */
    private final HeaderRewriter rewriter;

    /**
     * Constructs a new MessageTransformer instance.
     */
    public MessageTransformer() {
        this(new HeaderRewriter());
    }

    /**
     * Constructs a new MessageTransformer instance with given HeaderRewriter.
     *
     * @param rewriter HeaderRewriter instance.
     */
    public MessageTransformer(HeaderRewriter rewriter) {
        this.rewriter = rewriter;
    }

    /**
     * Transforms message.
     *
     * @param message         Raw message bytes.
     * @param updateDate      Replace Date line.
     * @param updateMessageId Replace Message-ID line.
     * @return Message bytes to transmit.
     * @throws MalformedMessageException No header and body boundary found.
     */
    public byte[] transform(byte[] message, boolean updateDate, boolean updateMessageId) throws MalformedMessageException {
        if (!updateDate && !updateMessageId) {
            return message;
        }

        MessageSplitter.Parts parts = MessageSplitter.split(message);
        byte[] header = rewriter.rewrite(parts.header(), updateDate, updateMessageId);
        log.debug("Header rewritten: {} bytes to {} bytes", parts.header().length, header.length);

        return MessageSplitter.combine(header, parts.body());
    }
}
