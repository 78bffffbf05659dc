package analysis.dataflow.interprocedural.pdg;

/**
 * Default call policy: unwrap async wrappers and analyze every other call
 */
public class UnwrapAsyncCallback implements CallChangeCallback {

    @Override
    public CallChanges onCall(CallInfo info) {
        if (info.isAsyncWrapper()) {
            return new CallChanges(SkipCall.unwrap());
        }
        return CallChanges.proceed();
    }
}
