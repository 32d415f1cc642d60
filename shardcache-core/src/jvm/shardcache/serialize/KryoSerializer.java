package shardcache.serialize;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import org.apache.log4j.Logger;
import org.objenesis.strategy.StdInstantiatorStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes cache values with Kryo. Kryo instances are not thread safe, so each thread gets
 * its own, built from the same list of registered classes.
 */
public class KryoSerializer implements Serializer {
    public static final Logger LOG = Logger.getLogger(KryoSerializer.class);

    private static final int INITIAL_BUFFER = 256;

    private transient volatile ThreadLocal<Kryo> kryo;
    private List<Class> registrations = new ArrayList<Class>();

    public KryoSerializer() {
    }

    public KryoSerializer(List<Class> registrations) {
        this.registrations = new ArrayList<Class>(registrations);
    }

    private Kryo freshKryo() {
        Kryo k = new Kryo();
        k.setRegistrationRequired(false);
        k.setReferences(true);
        k.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
        for (Class klass : registrations) {
            k.register(klass);
        }
        return k;
    }

    public Kryo getKryo() {
        if (kryo == null) {
            synchronized (this) {
                if (kryo == null)
                    kryo = new ThreadLocal<Kryo>();
            }
        }
        if (kryo.get() == null)
            kryo.set(freshKryo());

        return kryo.get();
    }

    public byte[] serialize(Object o) {
        if (LOG.isDebugEnabled())
            LOG.debug("Serializing object of " + (o == null ? "null" : o.getClass().getName()));
        Output ko = new Output(INITIAL_BUFFER, -1);
        getKryo().writeClassAndObject(ko, o);
        ko.flush();
        return ko.toBytes();
    }

    public Object deserialize(byte[] bytes) {
        return getKryo().readClassAndObject(new Input(bytes));
    }
}
