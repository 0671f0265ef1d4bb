package photorestore;

public interface Reducer<T> {

    void merge(T partial);

    T complete();
}
