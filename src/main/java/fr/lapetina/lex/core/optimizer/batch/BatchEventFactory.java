package fr.lapetina.lex.core.optimizer.batch;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates batch slots in the ring buffer.
 */
public final class BatchEventFactory implements EventFactory<BatchEvent> {

    @Override
    public BatchEvent newInstance() {
        return new BatchEvent();
    }
}
