package ou.capstone.fantasy.exceptions;

/**
 * The results provider failed while fetching or reading an event page.
 * Scoped to a single tournament; callers move on to the next one.
 */
public class ProviderException extends LeagueException
{
    public ProviderException( final String msg )
    {
        super( msg );
    }

    public ProviderException( final String msg, final Exception e )
    {
        super( msg, e );
    }
}
