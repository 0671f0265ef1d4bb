package photorestore;

@FunctionalInterface
public interface RegionWorker {

    void process(Region region);
}
