package redislite.network;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Live connections of one server. Register, deregister and the shutdown sweep
 * run under the write lock; lookups share the read lock.
 */
public class ConnectionRegistry {
    private final Map<Channel, ClientHandler> connections = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private boolean closed = false;

    /**
     * @return false if the registry was already swept by {@link #closeAll()}; the caller must close the channel
     */
    public boolean register(Channel channel, ClientHandler handler) {
        lock.writeLock().lock();
        try {
            if (closed) return false;
            connections.put(channel, handler);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void deregister(Channel channel) {
        lock.writeLock().lock();
        try {
            connections.remove(channel);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ClientHandler> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(connections.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Force-closes every registered channel and refuses later registrations.
     * Channels deregister themselves as their close completes.
     */
    public List<ChannelFuture> closeAll() {
        lock.writeLock().lock();
        try {
            closed = true;
            List<ChannelFuture> futures = new ArrayList<>(connections.size());
            for (Channel channel : new ArrayList<>(connections.keySet())) {
                futures.add(channel.close());
            }
            return futures;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isClosed() {
        lock.readLock().lock();
        try {
            return closed;
        } finally {
            lock.readLock().unlock();
        }
    }
}
