package ou.capstone.fantasy.exceptions;

/** The results website answered HTTP 429. */
public class RateLimitException extends ProviderException
{
    public RateLimitException( final String msg )
    {
        super( msg );
    }
}
