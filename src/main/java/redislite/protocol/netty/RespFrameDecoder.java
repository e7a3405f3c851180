package redislite.protocol.netty;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufInputStream;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.util.ByteProcessor;
import redislite.protocol.Message;
import redislite.protocol.RespEndOfStreamException;
import redislite.protocol.RespParser;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Netty decoder that turns inbound bytes into {@link Message}s using {@link RespParser}.
 *
 * <p>The parser only runs once a whole frame is buffered. Completeness is checked by walking
 * the frame's header lines and skipping bulk payloads by their declared length; the walk
 * resumes where the previous call stopped, so a frame arriving in many chunks costs one pass.
 * Anything the walk cannot make sense of is handed to the parser, which reports it.
 * A malformed frame is raised as a DecoderException and everything after it is discarded.
 */
public class RespFrameDecoder extends ByteToMessageDecoder {

    private boolean failed = false;

    // Progress of the completeness check, relative to the reader index of the current frame
    private long checked = 0;
    // Values (top-level frame or array elements) whose header has not been seen yet
    private long pending = 1;

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) throws Exception {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }
        if (!in.isReadable()) return;
        if (!frameBuffered(in)) return;
        resetCheck();

        in.markReaderIndex();
        try {
            Message message = new RespParser(new ByteBufInputStream(in)).parse();
            out.add(message);
        } catch (RespEndOfStreamException e) {
            // Frame not complete yet
            in.resetReaderIndex();
        } catch (Exception e) {
            failed = true;
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }

    /**
     * @return true when the parser should run: the frame is complete, or it is already
     *         known to be malformed
     */
    private boolean frameBuffered(ByteBuf in) {
        int start = in.readerIndex();
        int readable = in.readableBytes();

        while (pending > 0) {
            if (checked >= readable) return false;

            int lineStart = start + (int) checked;
            byte type = in.getByte(lineStart);
            if (type != '+' && type != '-' && type != ':' && type != '$' && type != '*') return true;

            int limit = Math.min(in.writerIndex(), lineStart + 1 + RespParser.MAX_LINE_LENGTH + 1);
            int eol = in.forEachByte(lineStart + 1, limit - lineStart - 1, ByteProcessor.FIND_CRLF);
            if (eol < 0) {
                // Overlong line: the parser rejects it
                return limit - lineStart - 1 > RespParser.MAX_LINE_LENGTH;
            }
            if (in.getByte(eol) == '\n') return true;
            if (eol + 1 >= in.writerIndex()) return false;
            if (in.getByte(eol + 1) != '\n') return true;

            pending--;
            checked = eol + 2 - start;

            if (type == '$' || type == '*') {
                long len;
                try {
                    len = Long.parseLong(in.toString(lineStart + 1, eol - lineStart - 1, StandardCharsets.US_ASCII));
                } catch (NumberFormatException e) {
                    return true;
                }
                if (len < -1) return true;
                if (type == '$') {
                    if (len > RespParser.MAX_BULK_LENGTH) return true;
                    if (len >= 0) checked += len + 2;
                } else {
                    if (len > Integer.MAX_VALUE) return true;
                    if (len > 0) pending += len;
                }
            }
        }
        return checked <= readable;
    }

    private void resetCheck() {
        checked = 0;
        pending = 1;
    }
}
