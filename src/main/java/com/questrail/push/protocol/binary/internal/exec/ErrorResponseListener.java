package com.questrail.push.protocol.binary.internal.exec;

import com.questrail.push.protocol.binary.codec.ErrorResponseDecoder;
import com.questrail.push.protocol.binary.codec.PushWireFormat;
import com.questrail.push.protocol.binary.model.PushErrorEvent;
import com.questrail.push.protocol.binary.transport.PushTransport;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * ErrorResponseListener
 * =============================================================================
 * Blocks on the transport for the peer's single error response.
 *
 * <p>The peer writes nothing back while it is happy, so this read only returns
 * when something has gone wrong:</p>
 * <ul>
 *   <li>Six bytes arrive: the peer rejected a notification and is about to
 *       close. The decoded response becomes the terminal event.</li>
 *   <li>The read fails: the stream ended, broke, or was closed locally (by a
 *       failed write or an explicit disconnect). A synthetic SHUTDOWN event
 *       with no notification id becomes the terminal event.</li>
 * </ul>
 *
 * <p>Exactly one event is handed to the sink, then the task returns.</p>
 */
public final class ErrorResponseListener implements Runnable
{
    private final PushTransport transport;
    private final ErrorResponseDecoder decoder;
    private final Consumer<PushErrorEvent> terminalSink;

    public ErrorResponseListener(PushTransport transport,
                                 ErrorResponseDecoder decoder,
                                 Consumer<PushErrorEvent> terminalSink)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.terminalSink = Objects.requireNonNull(terminalSink, "terminalSink");
    }

    @Override
    public void run()
    {
        byte[] response = new byte[PushWireFormat.ERROR_RESPONSE_LENGTH];
        PushErrorEvent event;
        try {
            transport.readFully(response);
            event = decoder.decode(response);
        } catch (IOException e) {
            event = PushErrorEvent.transportFailure(e);
        }
        terminalSink.accept(event);
    }
}
