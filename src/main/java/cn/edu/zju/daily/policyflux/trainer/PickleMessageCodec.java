package cn.edu.zju.daily.policyflux.trainer;

import cn.edu.zju.daily.policyflux.experience.ExperienceBatch;
import cn.edu.zju.daily.policyflux.experience.Transition;
import cn.edu.zju.daily.policyflux.policy.PolicyState;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.razorvine.pickle.Pickler;
import net.razorvine.pickle.Unpickler;

/**
 * Encodes {@link TrainerMessage}s as pickled dictionaries of the form {@code {"type": ...,
 * ...payload}}, so that a trainer unit may as well be a Python process.
 *
 * <p>Unpickled dicts have no defined order. Decoded maps are therefore filled in key order, so
 * that replies iterate the same way on every run.
 *
 * <p>Integers come back from the unpickler as {@link Integer} or {@link Long} depending on their
 * magnitude, so numbers are always read through {@link Number}.
 */
public class PickleMessageCodec {

    private static final String TYPE = "type";
    private static final String TRAINER_ID = "trainer_id";
    private static final String POLICY_STATE = "policy_state";
    private static final String EXPERIENCES = "experiences";
    private static final String TRACKER = "tracker";
    private static final String ERROR = "error";

    private final Pickler pickler = new Pickler();
    private final Unpickler unpickler = new Unpickler();

    public synchronized byte[] encode(TrainerMessage message) throws IOException {
        Map<String, Object> data = new HashMap<>();
        data.put(TYPE, message.getType().name());
        data.put(TRAINER_ID, message.getTrainerId());
        data.put(POLICY_STATE, encodeStates(message.getPolicyStates()));
        data.put(EXPERIENCES, encodeExperiences(message.getExperiences()));
        data.put(TRACKER, message.getTracker() == null ? null : encodeTracker(message.getTracker()));
        data.put(ERROR, message.getError());
        return pickler.dumps(data);
    }

    /**
     * @throws MalformedMessageException if the bytes are not a pickled message of a known type or
     *     a field holds a value of the wrong type
     */
    @SuppressWarnings("unchecked")
    public synchronized TrainerMessage decode(byte[] bytes) throws IOException {
        Object loaded;
        try {
            loaded = unpickler.loads(bytes);
        } catch (IOException | RuntimeException e) {
            throw new MalformedMessageException("Cannot unpickle message: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new MalformedMessageException("Expected a pickled dict, got " + describe(loaded));
        }
        Map<String, Object> data = (Map<String, Object>) loaded;
        Object type = data.get(TYPE);
        if (type == null) {
            throw new MalformedMessageException("Message has no type tag: " + data.keySet());
        }
        TrainerMessage message;
        try {
            message = new TrainerMessage(MessageType.valueOf(type.toString()));
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException("Unknown message type " + type, e);
        }
        try {
            decodeFields(data, message);
        } catch (ClassCastException | NullPointerException | IllegalArgumentException e) {
            throw new MalformedMessageException("Malformed " + type + " message: " + e, e);
        }
        return message;
    }

    @SuppressWarnings("unchecked")
    private static void decodeFields(Map<String, Object> data, TrainerMessage message) {
        message.setTrainerId((String) data.get(TRAINER_ID));
        if (data.get(POLICY_STATE) != null) {
            message.setPolicyStates(decodeStates((Map<String, Object>) data.get(POLICY_STATE)));
        }
        if (data.get(EXPERIENCES) != null) {
            message.setExperiences(decodeExperiences((Map<String, Object>) data.get(EXPERIENCES)));
        }
        if (data.get(TRACKER) != null) {
            message.setTracker(decodeTracker((Map<String, Object>) data.get(TRACKER)));
        }
        message.setError((String) data.get(ERROR));
    }

    // ======================
    // Policy states
    // ======================

    private static Map<String, Object> encodeStates(Map<String, PolicyState> states) {
        Map<String, Object> encoded = new LinkedHashMap<>();
        states.forEach(
                (name, state) -> {
                    Map<String, Object> fields = new HashMap<>();
                    fields.put("weights", state.getWeights());
                    fields.put("optimizer_state", state.getOptimizerState());
                    fields.put("learn_steps", state.getLearnSteps());
                    encoded.put(name, fields);
                });
        return encoded;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, PolicyState> decodeStates(Map<String, Object> encoded) {
        Map<String, PolicyState> states = new LinkedHashMap<>();
        sorted(encoded).forEach(
                (name, value) -> {
                    Map<String, Object> fields = (Map<String, Object>) value;
                    states.put(
                            name,
                            new PolicyState(
                                    decodeArrays((Map<String, Object>) fields.get("weights")),
                                    decodeArrays(
                                            (Map<String, Object>) fields.get("optimizer_state")),
                                    ((Number) fields.get("learn_steps")).longValue()));
                });
        return states;
    }

    private static Map<String, double[]> decodeArrays(Map<String, Object> encoded) {
        Map<String, double[]> arrays = new LinkedHashMap<>();
        if (encoded != null) {
            sorted(encoded).forEach((name, value) -> arrays.put(name, toDoubleArray(value)));
        }
        return arrays;
    }

    // ======================
    // Experiences
    // ======================

    private static Map<String, Object> encodeExperiences(Map<String, ExperienceBatch> experiences) {
        Map<String, Object> encoded = new LinkedHashMap<>();
        experiences.forEach(
                (name, batch) -> {
                    List<Object> transitions = new ArrayList<>(batch.size());
                    for (Transition transition : batch.getTransitions()) {
                        Map<String, Object> fields = new HashMap<>();
                        fields.put("state", transition.getState());
                        fields.put("action", transition.getAction());
                        fields.put("reward", transition.getReward());
                        fields.put("next_state", transition.getNextState());
                        fields.put("terminal", transition.isTerminal());
                        transitions.add(fields);
                    }
                    encoded.put(name, transitions);
                });
        return encoded;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ExperienceBatch> decodeExperiences(Map<String, Object> encoded) {
        Map<String, ExperienceBatch> experiences = new LinkedHashMap<>();
        sorted(encoded).forEach(
                (name, value) -> {
                    ExperienceBatch batch = new ExperienceBatch();
                    for (Object item : (List<Object>) value) {
                        Map<String, Object> fields = (Map<String, Object>) item;
                        batch.add(
                                new Transition(
                                        toDoubleArray(fields.get("state")),
                                        toDoubleArray(fields.get("action")),
                                        ((Number) fields.get("reward")).doubleValue(),
                                        toDoubleArray(fields.get("next_state")),
                                        Boolean.TRUE.equals(fields.get("terminal"))));
                    }
                    experiences.put(name, batch);
                });
        return experiences;
    }

    // ======================
    // Tracker
    // ======================

    private static Map<String, Object> encodeTracker(TrainerTracker tracker) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("trainer_id", tracker.getTrainerId());
        fields.put("round", tracker.getRound());
        fields.put("learn_results", tracker.getLearnResults());
        fields.put("learn_millis", tracker.getLearnMillis());
        fields.put("diagnostics", tracker.getDiagnostics());
        return fields;
    }

    @SuppressWarnings("unchecked")
    private static TrainerTracker decodeTracker(Map<String, Object> fields) {
        TrainerTracker tracker =
                new TrainerTracker(
                        (String) fields.get("trainer_id"),
                        ((Number) fields.get("round")).intValue());
        Map<String, Object> learnResults = (Map<String, Object>) fields.get("learn_results");
        if (learnResults != null) {
            sorted(learnResults).forEach(
                    (name, value) -> tracker.getLearnResults().put(name, (Boolean) value));
        }
        Map<String, Object> learnMillis = (Map<String, Object>) fields.get("learn_millis");
        if (learnMillis != null) {
            sorted(learnMillis).forEach(
                    (name, value) ->
                            tracker.getLearnMillis().put(name, ((Number) value).longValue()));
        }
        Map<String, Object> diagnostics = (Map<String, Object>) fields.get("diagnostics");
        if (diagnostics != null) {
            sorted(diagnostics).forEach(
                    (name, value) ->
                            tracker.getDiagnostics().put(name, (Map<String, Object>) value));
        }
        return tracker;
    }

    private static double[] toDoubleArray(Object value) {
        if (value == null || value instanceof double[]) {
            return (double[]) value;
        }
        if (value instanceof List) {
            // A Python peer may send plain lists instead of array('d').
            List<?> list = (List<?>) value;
            double[] array = new double[list.size()];
            for (int i = 0; i < array.length; i++) {
                array[i] = ((Number) list.get(i)).doubleValue();
            }
            return array;
        }
        throw new IllegalArgumentException("Cannot read a double array from " + describe(value));
    }

    private static <V> Map<String, V> sorted(Map<String, V> map) {
        return new TreeMap<>(map);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
