package works.odb.state;

@FunctionalInterface
public interface MutationListener {
	void onMutation(Mutation mutation);
}
