package PMIndex;

import java.util.ArrayList;
import java.util.List;

// Pattern matching index over a stream of string tokens.
public interface IPMIndexing {

    void insert(String key);

    boolean exists(List<String> pattern);

    ArrayList<Integer> report(List<String> pattern);

    void expire();

    int size();
}
