package viewchange.net;

import viewchange.common.MalformedMessageException;
import viewchange.common.MessageCodec;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;

//Reads one length prefixed frame, possibly across several reads.
public class BoundedByteBufferReceive {
    ByteBuffer sizeBuffer = ByteBuffer.allocate(MessageCodec.LENGTH_PREFIX_SIZE);
    public ByteBuffer contentBuffer = null;
    public boolean complete = false;

    public int readFrom(ReadableByteChannel socketChannel) throws IOException, MalformedMessageException {
        expectIncomplete();
        int read = 0;
        if (sizeBuffer.hasRemaining()) {
            int bytesRead = socketChannel.read(sizeBuffer);
            if (bytesRead < 0)
                throw new EOFException();
            read += bytesRead;
        }
        if(contentBuffer == null && !sizeBuffer.hasRemaining()) {
            sizeBuffer.rewind();
            var size = sizeBuffer.getInt();
            MessageCodec.checkFrameLength(size);
            contentBuffer = ByteBuffer.allocate(size);
        }
        // if we have a buffer read some stuff into it
        if(contentBuffer != null) {
            int bytesRead = socketChannel.read(contentBuffer);
            if (bytesRead < 0)
                throw new EOFException();
            read += bytesRead;
            // did we get everything?
            if(!contentBuffer.hasRemaining()) {
                contentBuffer.rewind();
                complete = true;
            }
        }

        return read;
    }

    public byte[] content() {
        expectComplete();
        return contentBuffer.array();
    }

    protected void expectIncomplete() {
        if(complete)
            throw new IllegalStateException("This operation cannot be completed on a complete request.");
    }

    protected void expectComplete() {
        if(!complete)
            throw new IllegalStateException("This operation cannot be completed on an incomplete request.");
    }
}
